package com.wscrape.capture;

import com.wscrape.model.LoginEntry;

import java.util.List;

/**
 * Receives the entries of each successful capture.
 *
 * <p>Called on the capture thread after every entry of the batch has been offered to the store. The
 * batch is the full parsed output, including entries that failed to persist. The next capture is not
 * scheduled until this method returns, so a slow observer stretches the capture interval.
 */
@FunctionalInterface
public interface CaptureObserver {

    /**
     * @param batch entries in report order, unmodifiable
     */
    void onCapture(List<LoginEntry> batch);
}
