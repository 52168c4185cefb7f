/*
 * Skirmish: a turn-based duel engine.
 * Copyright (C) 2026  Skirmish Team
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package skirmish.ai.simulation;

import skirmish.game.BattleQueue;
import skirmish.game.Combatant;
import skirmish.game.RestrictedBattleQueue;

import java.util.List;

/**
 * Builds lookup keys for search positions.
 *
 * Two positions get the same key exactly when they score the same: the key holds
 * both players' archetype, HP and SP, the ticket order (and permission bits of a
 * restricted queue) and whose point of view is being scored. Keys are only
 * compared within one decision, where the players' skills never change.
 */
public class GameStateHasher {

    /**
     * Computes the key of {@code queue} as seen by {@code perspective}.
     * Expects a cleaned queue, i.e. one that was just inspected.
     */
    public String computeKey(BattleQueue queue, Combatant perspective) {
        Combatant p1 = queue.getPlayer1();
        Combatant p2 = queue.getPlayer2();
        StringBuilder key = new StringBuilder(32 + queue.size() * 2);

        appendPlayer(key, p1);
        key.append('|');
        appendPlayer(key, p2);
        key.append('|');

        List<Combatant> tickets = queue.getTickets();
        boolean restricted = queue instanceof RestrictedBattleQueue;
        for (int i = 0; i < tickets.size(); i++) {
            key.append(tickets.get(i) == p1 ? '1' : '2');
            if (restricted) {
                key.append(((RestrictedBattleQueue) queue).canAdd(i) ? '+' : '-');
            }
        }
        key.append('|').append(perspective == p1 ? '1' : '2');
        return key.toString();
    }

    private static void appendPlayer(StringBuilder key, Combatant c) {
        key.append(c.getArchetype().charAt(0)).append(c.getHp()).append('/').append(c.getSp());
    }
}
