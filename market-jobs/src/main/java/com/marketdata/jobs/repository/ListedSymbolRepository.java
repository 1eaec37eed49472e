package com.marketdata.jobs.repository;

import com.marketdata.jobs.domain.ListedSymbol;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ListedSymbolRepository extends JpaRepository<ListedSymbol, Long> {

    List<ListedSymbol> findByTestIssueFalse();
}
