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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caches exact minimax scores of positions already searched during one decision.
 * Uses LRU (Least Recently Used) eviction when the table reaches its maximum size.
 *
 * Searches are exhaustive, so a stored score is final and can be returned for
 * any later visit of the same position regardless of depth.
 */
public class TranspositionTable {
    private final LinkedHashMap<String, Integer> table;
    private final int maxSize;
    private int hits;
    private int misses;

    /**
     * @param maxSize maximum number of entries to store
     */
    public TranspositionTable(int maxSize) {
        this.maxSize = maxSize;

        // LinkedHashMap with accessOrder=true implements LRU
        this.table = new LinkedHashMap<String, Integer>(Math.min(maxSize, 1 << 16) + 1, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
                return size() > TranspositionTable.this.maxSize;
            }
        };
    }

    /**
     * Creates a transposition table with default size (100,000 entries).
     */
    public TranspositionTable() {
        this(100000);
    }

    public void store(String key, int score) {
        table.put(key, score);
    }

    /**
     * @return the cached score, or null if the position was not searched yet
     */
    public Integer probe(String key) {
        Integer score = table.get(key);
        if (score != null) {
            hits++;
        } else {
            misses++;
        }
        return score;
    }

    public void clear() {
        table.clear();
        hits = 0;
        misses = 0;
    }

    public int size() {
        return table.size();
    }

    public int getHits() {
        return hits;
    }

    public int getMisses() {
        return misses;
    }

    /**
     * @return hit rate (0.0 to 1.0)
     */
    public double getHitRate() {
        int total = hits + misses;
        if (total == 0) return 0.0;
        return (double) hits / total;
    }

    public String getStatsSummary() {
        return String.format("TranspositionTable: size=%d, hits=%d, misses=%d, hitRate=%.2f%%",
                size(), hits, misses, getHitRate() * 100);
    }
}
