package in.zonetrader.domain.zone;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Watched liquidity levels per side, bounded, oldest evicted first.
 *
 * Levels within tolerance of an unconsumed level on the same side are merged:
 * the higher-ranked source wins.
 */
public final class LiquidityBook {

    private final int maxPerSide;
    private final Map<LiquiditySide, List<LiquidityLevel>> levels = new EnumMap<>(LiquiditySide.class);

    public LiquidityBook(int maxPerSide) {
        if (maxPerSide <= 0) {
            throw new IllegalArgumentException("maxPerSide must be positive: " + maxPerSide);
        }
        this.maxPerSide = maxPerSide;
        levels.put(LiquiditySide.BUY_SIDE, new ArrayList<>());
        levels.put(LiquiditySide.SELL_SIDE, new ArrayList<>());
    }

    /**
     * Add a level unless an equal-or-better one already sits within tolerance.
     *
     * @return true if the level was stored
     */
    public boolean add(LiquidityLevel level, BigDecimal tolerance) {
        List<LiquidityLevel> side = levels.get(level.getSide());

        for (int i = 0; i < side.size(); i++) {
            LiquidityLevel existing = side.get(i);
            if (existing.isConsumed()) {
                continue;
            }
            if (existing.getPrice().subtract(level.getPrice()).abs().compareTo(tolerance) <= 0) {
                if (level.getSource().getRank() > existing.getSource().getRank()) {
                    side.remove(i);
                    break;
                }
                return false;
            }
        }

        side.add(level);
        if (side.size() > maxPerSide) {
            side.remove(0);
        }
        return true;
    }

    /**
     * Drop all unconsumed levels of one source (e.g. yesterday's previous-day high).
     */
    public void removeUnconsumed(LiquiditySource source) {
        levels.get(source.getSide()).removeIf(l -> l.getSource() == source && !l.isConsumed());
    }

    public List<LiquidityLevel> unconsumed(LiquiditySide side) {
        return levels.get(side).stream().filter(l -> !l.isConsumed()).toList();
    }

    public List<LiquidityLevel> unconsumed() {
        List<LiquidityLevel> result = new ArrayList<>(unconsumed(LiquiditySide.BUY_SIDE));
        result.addAll(unconsumed(LiquiditySide.SELL_SIDE));
        return result;
    }

    public int size(LiquiditySide side) {
        return levels.get(side).size();
    }
}
