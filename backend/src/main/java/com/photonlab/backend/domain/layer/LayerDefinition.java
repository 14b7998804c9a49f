package com.photonlab.backend.domain.layer;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One layer of the stack. Thicknesses and pattern dimensions in µm.
 * For {@link HoleShape#ELLIPSE}, {@code patternWidth}/{@code patternHeight} hold the semi-major/semi-minor axes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LayerDefinition(
        String id,
        String name,
        Material material,
        double thickness,

        // optical overrides; null means material default
        Double n,
        Double k,
        Double epsilonReal,
        Double epsilonImag,

        boolean hasPattern,
        PatternType patternType,
        HoleShape holeShape,
        Material patternMaterial,
        Double patternRadius,
        Double patternWidth,
        Double patternHeight,
        Double patternFillFactor,

        int order
) {}
