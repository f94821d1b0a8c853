package com.pwsrelay.acquisition.fetch;

import com.pwsrelay.acquisition.error.AcquisitionException;
import com.pwsrelay.core.model.ObservationDocument;
import com.pwsrelay.core.model.SourceConfig;

@FunctionalInterface
public interface SourceFetcher {
    /**
     * Fetches and merges current conditions (and forecast, when enabled) for one source.
     *
     * @throws AcquisitionException classified failure; the caller decides how to record it
     */
    ObservationDocument fetch(SourceConfig source);
}
