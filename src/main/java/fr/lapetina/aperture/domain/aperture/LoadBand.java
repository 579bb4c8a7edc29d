package fr.lapetina.aperture.domain.aperture;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sizes the aperture from observed load.
 *
 * The dispatch loop reports each request's start and end. The band keeps an
 * exponentially smoothed count of outstanding requests and divides it by the
 * current window size; above {@code highLoad} the controller widens the
 * aperture by one node, below {@code lowLoad} it narrows it by one.
 *
 * Thread-safe.
 */
public final class LoadBand {

    private final ApertureController controller;
    private final double lowLoad;
    private final double highLoad;
    private final double smoothing;

    private final AtomicInteger outstanding = new AtomicInteger(0);
    private final Object lock = new Object();
    private double smoothedLoad;

    /**
     * @param controller controller to adjust
     * @param lowLoad    per-node load under which the aperture shrinks
     * @param highLoad   per-node load over which the aperture grows
     * @param smoothing  weight of the newest sample, in {@code (0, 1]}
     */
    public LoadBand(ApertureController controller, double lowLoad, double highLoad, double smoothing) {
        if (lowLoad < 0 || highLoad <= lowLoad) {
            throw new IllegalArgumentException(
                    "load band requires 0 <= lowLoad < highLoad, got [" + lowLoad + ", " + highLoad + "]");
        }
        if (smoothing <= 0 || smoothing > 1) {
            throw new IllegalArgumentException("smoothing must be in (0, 1], got " + smoothing);
        }
        this.controller = controller;
        this.lowLoad = lowLoad;
        this.highLoad = highLoad;
        this.smoothing = smoothing;
    }

    public void onRequestStart() {
        sample(outstanding.incrementAndGet());
    }

    public void onRequestEnd() {
        sample(outstanding.decrementAndGet());
    }

    private void sample(int current) {
        double perNode;
        synchronized (lock) {
            smoothedLoad += smoothing * (current - smoothedLoad);
            perNode = smoothedLoad / Math.max(1, controller.window().size());
        }

        if (perNode > highLoad) {
            controller.adjustForLoad(1);
        } else if (perNode < lowLoad) {
            controller.adjustForLoad(-1);
        }
    }

    public int getOutstanding() {
        return outstanding.get();
    }

    public double getSmoothedLoad() {
        synchronized (lock) {
            return smoothedLoad;
        }
    }
}
