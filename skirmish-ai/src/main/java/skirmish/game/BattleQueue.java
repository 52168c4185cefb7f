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
package skirmish.game;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The order in which combatants take their turns.
 *
 * Each entry (a ticket) is one pending turn. A combatant may hold any number of
 * tickets. The first two distinct combatants ever seen become the two players of
 * the match; the queue decides when the match is over and who won it.
 *
 * Tickets whose owner has no available action are dropped lazily from the front
 * whenever the queue is inspected.
 */
public class BattleQueue {
    protected final List<Combatant> tickets = new ArrayList<>();
    protected Combatant player1;
    protected Combatant player2;

    /**
     * Drops tickets from the front until the front owner can act.
     */
    protected void cleanQueue() {
        while (!tickets.isEmpty() && tickets.get(0).getAvailableActions().isEmpty()) {
            tickets.remove(0);
        }
    }

    /**
     * Appends a ticket for the given combatant. The very first ticket fixes the players.
     */
    public void add(Combatant combatant) {
        tickets.add(combatant);
        registerPlayers(combatant);
    }

    protected void registerPlayers(Combatant combatant) {
        if (player1 == null) {
            Preconditions.checkState(combatant.getEnemy() != null,
                    "%s must have an enemy before joining a battle queue", combatant.getName());
            player1 = combatant;
            player2 = combatant.getEnemy();
        }
    }

    /**
     * Removes and returns the combatant at the front of the queue.
     *
     * @throws EmptyQueueException if no ticket is left after cleaning
     */
    public Combatant remove() {
        cleanQueue();
        if (tickets.isEmpty()) {
            throw new EmptyQueueException("Cannot remove from an empty battle queue");
        }
        return tickets.remove(0);
    }

    public boolean isEmpty() {
        cleanQueue();
        return tickets.isEmpty();
    }

    /**
     * Returns the combatant at the front without removing it, or player 1 when
     * there is no ticket left.
     */
    public Combatant peek() {
        cleanQueue();
        if (!tickets.isEmpty()) {
            return tickets.get(0);
        }
        return player1;
    }

    /**
     * A match is over once nobody can act or one of the players is down to 0 HP.
     */
    public boolean isOver() {
        if (isEmpty()) {
            return true;
        }
        return player1.getHp() == 0 || player2.getHp() == 0;
    }

    /**
     * Returns the winner of a finished match, or null while it is running, when
     * it ended in a tie, or when no combatant ever joined the queue.
     */
    public Combatant getWinner() {
        if (player1 == null || !isOver()) {
            return null;
        }
        boolean p1Down = player1.getHp() == 0;
        boolean p2Down = player2.getHp() == 0;
        if (p1Down && p2Down) {
            return null;
        }
        if (p1Down) {
            return player2;
        }
        if (p2Down) {
            return player1;
        }
        return null;
    }

    /**
     * Returns an independent copy of this queue holding copies of both players.
     * Nothing done to the copy, or to the combatants inside it, affects this queue.
     */
    public BattleQueue copy() {
        BattleQueue copy = new BattleQueue();
        fillCopy(copy);
        return copy;
    }

    /**
     * Clones both players into {@code target}, links them and replays every ticket
     * through {@code target.add}, so subclasses rebuild their own bookkeeping.
     */
    protected void fillCopy(BattleQueue target) {
        if (player1 == null) {
            return;
        }
        Combatant p1Copy = player1.copy(target);
        Combatant p2Copy = player2.copy(target);
        p1Copy.setEnemy(p2Copy);
        p2Copy.setEnemy(p1Copy);

        target.player1 = p1Copy;
        target.player2 = p2Copy;

        for (Combatant c : tickets) {
            target.add(c == player1 ? p1Copy : p2Copy);
        }
    }

    public Combatant getPlayer1() {
        return player1;
    }

    public Combatant getPlayer2() {
        return player2;
    }

    /**
     * Raw ticket count, without cleaning.
     */
    public int size() {
        return tickets.size();
    }

    public List<Combatant> getTickets() {
        return Collections.unmodifiableList(tickets);
    }

    @Override
    public String toString() {
        return tickets.stream().map(Combatant::toString).collect(Collectors.joining(" -> "));
    }
}
