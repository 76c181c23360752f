package com.tilestream.render;

import org.joml.Vector2fc;

/**
 * Read-only view of the camera, polled once per scheduling tick.
 */
public interface ViewportProvider {

    /** Viewport centre in world pixels. */
    Vector2fc getCenter();

    /** Viewport size in screen pixels. */
    Vector2fc getViewportSize();

    /** Zoom factor; values above 1 show less of the world. */
    float getZoom();
}
