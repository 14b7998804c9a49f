package com.photonlab.backend.domain.layer;

public record ResolvedLayer(
        LayerDefinition layer,
        LayerOptics optics
) {}
