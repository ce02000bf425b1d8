package io.autotel;

import io.autotel.spi.Meter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/** {@link Meter} that keeps every measurement in memory. */
public final class RecordingMeter implements Meter {

    public record Sample(String name, double value, Map<String, String> tags) {
    }

    private final List<Sample> samples = new CopyOnWriteArrayList<>();

    @Override
    public Counter createCounter(String name) {
        return (amount, tags) -> samples.add(new Sample(name, amount, Map.copyOf(tags)));
    }

    @Override
    public Histogram createHistogram(String name) {
        return (value, tags) -> samples.add(new Sample(name, value, Map.copyOf(tags)));
    }

    /** Sum of all values recorded under {@code name} with the given tag. */
    public double sum(String name, String tagKey, String tagValue) {
        double total = 0;
        for (Sample sample : samples(name, tagKey, tagValue)) {
            total += sample.value();
        }
        return total;
    }

    public List<Sample> samples(String name, String tagKey, String tagValue) {
        return samples.stream()
                .filter(s -> s.name().equals(name) && tagValue.equals(s.tags().get(tagKey)))
                .toList();
    }

    public List<Sample> samples(String name) {
        return samples.stream().filter(s -> s.name().equals(name)).toList();
    }
}
