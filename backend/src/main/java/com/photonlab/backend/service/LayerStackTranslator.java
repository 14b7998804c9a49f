package com.photonlab.backend.service;

import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.layer.HoleShape;
import com.photonlab.backend.domain.layer.LayerDefinition;
import com.photonlab.backend.domain.layer.LayerOptics;
import com.photonlab.backend.domain.layer.LayerStackConfig;
import com.photonlab.backend.domain.layer.Material;
import com.photonlab.backend.domain.layer.PatternType;
import com.photonlab.backend.domain.layer.ResolvedLayer;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Maps a layer stack onto the flat parameter set. Only geometry and material fields are rewritten.
 */
@Component
public class LayerStackTranslator {

    /** Nominal substrate allowance added below the slab, µm. */
    static final double SUBSTRATE_ALLOWANCE = 3.0;

    public SimulationConfig toCanonical(LayerStackConfig stack, SimulationConfig base) {
        Objects.requireNonNull(stack, "layer stack is required");
        Objects.requireNonNull(base, "base config is required");

        Material substrate = stack.substrate() == null ? Material.GLASS : stack.substrate();
        double substrateN = substrate.defaultN();

        List<LayerDefinition> layers = stack.layers();
        int slabIndex = -1;
        for (int i = 0; i < layers.size(); i++) {
            if (layers.get(i).hasPattern()) {
                slabIndex = i;
                break;
            }
        }

        if (slabIndex < 0) {
            return base.withNGlass(substrateN).withLatticeConstant(stack.latticeConstant());
        }

        LayerDefinition slab = layers.get(slabIndex);
        LayerOptics optics = opticsOf(slab);

        double below = 0;
        for (int i = slabIndex + 1; i < layers.size(); i++) {
            LayerDefinition l = layers.get(i);
            if (!l.hasPattern()) below += l.thickness();
        }

        return base.withStructure(
                stack.latticeConstant(),
                equivalentRadius(slab, base.radius()),
                slab.thickness(),
                below + SUBSTRATE_ALLOWANCE,
                optics.n(),
                optics.k(),
                substrateN
        );
    }

    /**
     * Radius of the circular hole the flat model uses in place of the layer's hole shape.
     */
    public double equivalentRadius(LayerDefinition layer, double fallback) {
        double radius = layer.patternRadius() != null ? layer.patternRadius() : fallback;
        HoleShape shape = layer.holeShape() == null ? HoleShape.CIRCLE : layer.holeShape();
        Double w = layer.patternWidth();
        Double h = layer.patternHeight();
        boolean hasDims = w != null && h != null && w > 0 && h > 0;

        return switch (shape) {
            case CIRCLE -> radius;
            case RECTANGLE -> hasDims ? Math.sqrt(w * h / Math.PI) : radius;   // area-equivalent disk
            case ELLIPSE -> hasDims ? Math.sqrt(w * h) : radius;               // geometric mean of semi-axes
        };
    }

    public LayerOptics opticsOf(LayerDefinition layer) {
        Material material = layer.material() == null ? Material.CUSTOM : layer.material();
        double n = layer.n() != null ? layer.n() : material.defaultN();
        double k = layer.k() != null ? layer.k() : material.defaultK();
        double epsReal = layer.epsilonReal() != null ? layer.epsilonReal() : n * n - k * k;
        double epsImag = layer.epsilonImag() != null ? layer.epsilonImag() : 2 * n * k;
        return new LayerOptics(n, k, epsReal, epsImag);
    }

    /**
     * Every layer with its effective optics, in stack order.
     */
    public List<ResolvedLayer> resolve(LayerStackConfig stack) {
        Objects.requireNonNull(stack, "layer stack is required");
        return stack.layers().stream()
                .sorted(Comparator.comparingInt(LayerDefinition::order))
                .map(l -> new ResolvedLayer(l, opticsOf(l)))
                .toList();
    }

    /**
     * Lossy inverse: one patterned silicon layer mirroring the canonical slab. Meant to seed an editor.
     */
    public LayerStackConfig fromCanonical(SimulationConfig config) {
        Objects.requireNonNull(config, "config is required");
        LayerDefinition slab = new LayerDefinition(
                "pcs-" + UUID.randomUUID(),
                "Si-PCS",
                Material.SILICON,
                config.thickness(),
                config.nSilicon(),
                config.kSilicon() > 0 ? config.kSilicon() : null,
                null,
                null,
                true,
                PatternType.SQUARE,
                HoleShape.CIRCLE,
                Material.VACUUM,
                config.radius(),
                null,
                null,
                null,
                0
        );
        return new LayerStackConfig(
                config.latticeConstant() > 0 ? config.latticeConstant() : 0.5,
                List.of(slab),
                Material.VACUUM,
                Material.GLASS,
                false,
                Material.GOLD,
                0.1
        );
    }
}
