package com.futures.monitor.service;

import com.futures.monitor.model.Position;
import com.futures.monitor.model.PositionSide;

import java.util.Optional;

/**
 * Selects open positions by symbol and/or side. Empty criteria match everything.
 */
public record PositionFilter(Optional<String> symbol, Optional<PositionSide> side) {

    public static final PositionFilter ALL = new PositionFilter(Optional.empty(), Optional.empty());

    public static PositionFilter symbol(String symbol) {
        return new PositionFilter(Optional.of(symbol), Optional.empty());
    }

    public static PositionFilter side(PositionSide side) {
        return new PositionFilter(Optional.empty(), Optional.of(side));
    }

    public boolean matches(Position position) {
        return symbol.map(s -> s.equalsIgnoreCase(position.symbol())).orElse(true)
            && side.map(s -> s == position.side()).orElse(true);
    }
}
