package com.project.lepidoptera.landmarks.render;

import java.util.Arrays;
import java.util.Optional;

/**
 * Up to four optional rendering surfaces, addressed by slot. Empty slots are
 * skipped by whoever draws.
 */
public final class OverlaySurfaces {
    public static final int MAX_SURFACES = 4;

    private static final OverlaySurfaces NONE = new OverlaySurfaces(new RenderingSurface[0]);

    private final RenderingSurface[] slots;

    private OverlaySurfaces(RenderingSurface[] slots) {
        this.slots = slots;
    }

    public static OverlaySurfaces none() {
        return NONE;
    }

    /** Slots in order; {@code null} entries leave a slot empty. */
    public static OverlaySurfaces of(RenderingSurface... surfaces) {
        if (surfaces.length > MAX_SURFACES) {
            throw new IllegalArgumentException(
                    "At most " + MAX_SURFACES + " surfaces supported, got " + surfaces.length);
        }
        return new OverlaySurfaces(Arrays.copyOf(surfaces, surfaces.length));
    }

    public Optional<RenderingSurface> get(int slot) {
        if (slot < 0 || slot >= slots.length) return Optional.empty();
        return Optional.ofNullable(slots[slot]);
    }

    public boolean isEmpty() {
        for (RenderingSurface s : slots) if (s != null) return false;
        return true;
    }
}
