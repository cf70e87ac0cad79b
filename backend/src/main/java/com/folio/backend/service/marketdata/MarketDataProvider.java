package com.folio.backend.service.marketdata;

import com.folio.backend.exception.DataUnavailableException;
import com.folio.backend.model.PriceBar;

import java.time.LocalDate;
import java.util.List;

public interface MarketDataProvider {

    /**
     * Daily bars for {@code ticker} between {@code start} and {@code end}
     * inclusive, ordered by date with one bar per date.
     *
     * @throws DataUnavailableException when the ticker is unknown, the window is
     *                                  empty, or the provider cannot be reached
     */
    List<PriceBar> getPriceHistory(String ticker, LocalDate start, LocalDate end);
}
