package io.intellixity.frugal.examples.service;

import io.intellixity.frugal.access.exec.AggregateResult;
import io.intellixity.frugal.access.exec.CallOptions;
import io.intellixity.frugal.access.exec.ProjectedRows;
import io.intellixity.frugal.access.facade.ResourceAccessFacade;
import io.intellixity.frugal.access.query.EntityQuery;
import io.intellixity.frugal.access.query.QueryElement;
import io.intellixity.frugal.access.query.SortField;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.query.aggregation.GroupBy;
import io.intellixity.frugal.examples.domain.CatalogSchemas;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class SalesService {
  private static final CallOptions REQUEST = CallOptions.timeout(Duration.ofSeconds(5));

  private final ResourceAccessFacade facade;

  public SalesService(ResourceAccessFacade facade) {
    this.facade = facade;
  }

  public AggregateResult total(QueryElement filter) {
    return facade.aggregate(EntityQuery.of(CatalogSchemas.SALE).withFilter(filter), Aggregate.sum("amount"), REQUEST);
  }

  public ProjectedRows byRegion(QueryElement filter) {
    EntityQuery q = EntityQuery.of(CatalogSchemas.SALE)
        .withFilter(filter)
        .withSort(List.of(SortField.asc("region")));
    return facade.aggregate(q, List.of(Aggregate.sum("amount"), Aggregate.avg("amount"), Aggregate.count()),
        GroupBy.of("region"), REQUEST);
  }
}
