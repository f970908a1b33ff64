package com.futures.monitor.cache;

import com.futures.monitor.model.Trade;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bounded, per-symbol window of executed trades.
 *
 * Trades are appended as they are fetched, de-duplicated by id and kept in (time, id) order.
 * When a symbol exceeds its capacity the oldest trades are dropped.
 */
public class TradeWindow {
    private static final Comparator<Trade> ORDER =
        Comparator.comparing(Trade::time).thenComparingLong(Trade::id);

    private final int capacityPerSymbol;
    private final Map<String, TreeSet<Trade>> bySymbol = new HashMap<>();

    public TradeWindow(int capacityPerSymbol) {
        if (capacityPerSymbol < 1) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacityPerSymbol = capacityPerSymbol;
    }

    /**
     * Append fetched trades.
     *
     * @return number of trades that were not already in the window
     */
    public synchronized int merge(List<Trade> trades) {
        int added = 0;
        for (Trade trade : trades) {
            TreeSet<Trade> window = bySymbol.computeIfAbsent(trade.symbol(), s -> new TreeSet<>(ORDER));
            if (containsId(window, trade.id())) {
                continue;
            }
            window.add(trade);
            added++;
            while (window.size() > capacityPerSymbol) {
                window.pollFirst();
            }
        }
        return added;
    }

    /**
     * Most recent trades for a symbol, oldest first.
     */
    public synchronized List<Trade> recent(String symbol, int limit) {
        TreeSet<Trade> window = bySymbol.get(symbol);
        if (window == null) {
            return List.of();
        }
        return tail(new ArrayList<>(window), limit);
    }

    /**
     * Most recent trades across all symbols, oldest first.
     */
    public synchronized List<Trade> recent(int limit) {
        var all = new ArrayList<Trade>();
        for (TreeSet<Trade> window : bySymbol.values()) {
            all.addAll(window);
        }
        all.sort(ORDER);
        return tail(all, limit);
    }

    public synchronized Set<String> symbols() {
        return Set.copyOf(bySymbol.keySet());
    }

    public synchronized int size() {
        return bySymbol.values().stream().mapToInt(TreeSet::size).sum();
    }

    private static boolean containsId(TreeSet<Trade> window, long id) {
        for (Trade existing : window.descendingSet()) {
            if (existing.id() == id) {
                return true;
            }
        }
        return false;
    }

    private static List<Trade> tail(List<Trade> ordered, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int from = Math.max(0, ordered.size() - limit);
        return List.copyOf(ordered.subList(from, ordered.size()));
    }
}
