package com.tilestream.render;

import org.joml.Vector2f;
import org.joml.Vector2fc;

/**
 * 2D camera with smoothed movement and zoom. {@link #moveBy} and
 * {@link #zoomBy} set targets; {@link #update(float)} eases the current
 * position and zoom towards them.
 */
public class PanningCamera implements ViewportProvider {

    private final Vector2f position = new Vector2f();
    private final Vector2f targetPosition = new Vector2f();
    private final Vector2f viewportSize = new Vector2f();

    private float zoom = 1.0f;
    private float targetZoom = 1.0f;

    private float minZoom = 0.5f;
    private float maxZoom = 2.0f;
    private float smoothSpeed = 5.0f;

    public PanningCamera(float viewportWidth, float viewportHeight) {
        this.viewportSize.set(viewportWidth, viewportHeight);
    }

    public void update(float dt) {
        float t = Math.min(1.0f, smoothSpeed * dt);
        position.lerp(targetPosition, t);
        zoom += (targetZoom - zoom) * t;
    }

    public void moveBy(float dx, float dy) {
        targetPosition.add(dx, dy);
    }

    /** Move immediately, skipping the smoothing. */
    public void teleport(float x, float y) {
        position.set(x, y);
        targetPosition.set(x, y);
    }

    public void zoomBy(float delta) {
        targetZoom = clampZoom(targetZoom + delta);
    }

    public void setZoom(float value) {
        zoom = clampZoom(value);
        targetZoom = zoom;
    }

    public void setZoomLimits(float min, float max) {
        if (!(min > 0f) || max < min) {
            throw new IllegalArgumentException("Invalid zoom limits [" + min + ", " + max + "]");
        }
        this.minZoom = min;
        this.maxZoom = max;
        this.targetZoom = clampZoom(targetZoom);
        this.zoom = clampZoom(zoom);
    }

    public void setSmoothSpeed(float smoothSpeed) { this.smoothSpeed = smoothSpeed; }

    public void setViewportSize(float width, float height) {
        viewportSize.set(width, height);
    }

    private float clampZoom(float z) {
        return Math.max(minZoom, Math.min(maxZoom, z));
    }

    @Override
    public Vector2fc getCenter() { return position; }

    @Override
    public Vector2fc getViewportSize() { return viewportSize; }

    @Override
    public float getZoom() { return zoom; }

    public Vector2fc getTargetPosition() { return targetPosition; }
    public float getTargetZoom() { return targetZoom; }
}
