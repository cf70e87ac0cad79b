package com.folio.backend.repository;

import com.folio.backend.model.Position;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface PositionRepository extends JpaRepository<Position, String> {
    List<Position> findByTickerIn(Collection<String> tickers);
    List<Position> findAllByOrderByTickerAsc();
}
