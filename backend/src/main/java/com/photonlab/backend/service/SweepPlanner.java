package com.photonlab.backend.service;

import com.photonlab.backend.config.PhotonLabProperties;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SweepConfig;
import com.photonlab.backend.domain.SweepParameter;
import com.photonlab.backend.domain.SweepPreview;
import com.photonlab.backend.domain.WavelengthRange;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands a sweep request into concrete configurations. Pure; never runs anything.
 */
@Component
public class SweepPlanner {

    private static final int VALUE_SCALE = 6;

    private final double secondsPerWavelength;
    private final double parallelEfficiency;

    @Autowired
    public SweepPlanner(PhotonLabProperties properties) {
        this(properties.getSweep().getSecondsPerWavelength(), properties.getSweep().getParallelEfficiency());
    }

    public SweepPlanner(double secondsPerWavelength, double parallelEfficiency) {
        this.secondsPerWavelength = secondsPerWavelength;
        this.parallelEfficiency = parallelEfficiency;
    }

    /**
     * Evenly spaced values from start to end inclusive, rounded to 6 decimals.
     */
    public List<Double> valuesOf(SweepParameter sweep) {
        int count = sweep.pointCount();
        List<Double> values = new ArrayList<>(count);
        if (count == 1) {
            values.add(round(sweep.start()));
            return values;
        }
        double span = sweep.end() - sweep.start();
        for (int i = 0; i < count; i++) {
            double v = i == count - 1 ? sweep.end() : sweep.start() + span * i / (count - 1);
            values.add(round(v));
        }
        return values;
    }

    /**
     * Cartesian product of all ranges; the first sweep varies slowest, the last fastest.
     */
    public List<SimulationConfig> expand(SweepConfig request) {
        Objects.requireNonNull(request, "sweep request is required");
        SimulationConfig base = Objects.requireNonNull(request.baseConfig(), "base_config is required");
        List<SweepParameter> sweeps = request.sweeps();
        if (sweeps.isEmpty()) return List.of(base);

        List<List<Double>> axes = sweeps.stream().map(this::valuesOf).toList();
        int total = totalOf(axes);

        List<SimulationConfig> out = new ArrayList<>(total);
        int[] cursor = new int[axes.size()];
        for (int n = 0; n < total; n++) {
            SimulationConfig c = base;
            for (int i = 0; i < axes.size(); i++) {
                c = sweeps.get(i).name().apply(c, axes.get(i).get(cursor[i]));
            }
            out.add(c);
            advance(cursor, axes);
        }
        return List.copyOf(out);
    }

    public int totalSimulations(SweepConfig request) {
        long total = 1;
        for (SweepParameter s : request.sweeps()) {
            total *= s.pointCount();
            if (total > Integer.MAX_VALUE) throw new IllegalArgumentException("Sweep is too large: more than " + Integer.MAX_VALUE + " combinations");
        }
        return (int) total;
    }

    /**
     * Sizes and a linear wall-clock estimate for the request.
     *
     * @param parallelism workers available to the sweep
     */
    public SweepPreview preview(SweepConfig request, int parallelism) {
        int total = totalSimulations(request);
        WavelengthRange w = request.baseConfig() == null ? null : request.baseConfig().wavelength();
        long wavelengthPoints = (long) total * (w == null ? 1 : w.pointCount());

        double effective = Math.max(1.0, Math.min(parallelism, total) * parallelEfficiency);
        double estimate = secondsPerWavelength * wavelengthPoints / effective;

        List<SweepPreview.ParameterPoints> perParameter = request.sweeps().stream()
                .map(s -> new SweepPreview.ParameterPoints(s.name(), s.start(), s.end(), s.step(), s.pointCount()))
                .toList();
        return new SweepPreview(total, wavelengthPoints, estimate, perParameter);
    }

    /**
     * Estimate for a single run; same cost model as {@link #preview}.
     */
    public double estimateSingleRun(SimulationConfig config, int parallelism) {
        int points = config.wavelength() == null ? 1 : config.wavelength().pointCount();
        return secondsPerWavelength * points / Math.max(1, parallelism);
    }

    private static int totalOf(List<List<Double>> axes) {
        long total = 1;
        for (List<Double> axis : axes) total *= axis.size();
        if (total > Integer.MAX_VALUE) throw new IllegalArgumentException("Sweep is too large");
        return (int) total;
    }

    // odometer: last axis ticks fastest
    private static void advance(int[] cursor, List<List<Double>> axes) {
        for (int i = cursor.length - 1; i >= 0; i--) {
            if (++cursor[i] < axes.get(i).size()) return;
            cursor[i] = 0;
        }
    }

    private static double round(double v) {
        return BigDecimal.valueOf(v).setScale(VALUE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
