package in.zonetrader.domain.zone;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded zone storage for one instrument and resolution.
 *
 * Holds at most maxPerSide zones per (kind, polarity at formation); the oldest is evicted first.
 */
public final class ZoneBook {

    private final int maxPerSide;
    private final Map<ZoneKind, Map<Polarity, Deque<Zone>>> zones = new EnumMap<>(ZoneKind.class);

    public ZoneBook(int maxPerSide) {
        if (maxPerSide <= 0) {
            throw new IllegalArgumentException("maxPerSide must be positive: " + maxPerSide);
        }
        this.maxPerSide = maxPerSide;
    }

    /**
     * Add a new zone.
     *
     * @return The evicted zone, if the side was full
     */
    public Optional<Zone> add(Zone zone) {
        Deque<Zone> side = zones
            .computeIfAbsent(zone.getKind(), k -> new EnumMap<>(Polarity.class))
            .computeIfAbsent(zone.getPolarity(), p -> new ArrayDeque<>());
        side.addLast(zone);
        if (side.size() > maxPerSide) {
            return Optional.of(side.removeFirst());
        }
        return Optional.empty();
    }

    /**
     * All zones, oldest first.
     */
    public List<Zone> all() {
        List<Zone> result = new ArrayList<>();
        for (Map<Polarity, Deque<Zone>> byPolarity : zones.values()) {
            for (Deque<Zone> side : byPolarity.values()) {
                result.addAll(side);
            }
        }
        result.sort(Comparator.comparing(Zone::getFormedAt).thenComparing(Zone::getKind));
        return result;
    }

    /**
     * Active zones whose band contains the price.
     */
    public List<Zone> activeContaining(BigDecimal price) {
        return all().stream()
            .filter(Zone::isActive)
            .filter(z -> z.contains(price))
            .toList();
    }

    public int size(ZoneKind kind, Polarity polarity) {
        Map<Polarity, Deque<Zone>> byPolarity = zones.get(kind);
        if (byPolarity == null) {
            return 0;
        }
        Deque<Zone> side = byPolarity.get(polarity);
        return side == null ? 0 : side.size();
    }

    public int size() {
        int total = 0;
        for (Map<Polarity, Deque<Zone>> byPolarity : zones.values()) {
            for (Deque<Zone> side : byPolarity.values()) {
                total += side.size();
            }
        }
        return total;
    }
}
