package io.intellixity.frugal.examples.service;

import io.intellixity.frugal.access.exec.CallOptions;
import io.intellixity.frugal.access.exec.EntityGraph;
import io.intellixity.frugal.access.exec.EntityNode;
import io.intellixity.frugal.access.exec.ProjectedRows;
import io.intellixity.frugal.access.facade.ResourceAccessFacade;
import io.intellixity.frugal.access.query.EntityQuery;
import io.intellixity.frugal.access.query.OffsetPage;
import io.intellixity.frugal.access.query.QueryFilters;
import io.intellixity.frugal.access.query.SortField;
import io.intellixity.frugal.examples.domain.CatalogSchemas;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class ProductService {
  private static final CallOptions REQUEST = CallOptions.timeout(Duration.ofSeconds(5));

  private final ResourceAccessFacade facade;

  public ProductService(ResourceAccessFacade facade) {
    this.facade = facade;
  }

  /** Product page: the product, its reviews and its supplier in one planned fetch. */
  public EntityNode get(long id) {
    EntityQuery q = EntityQuery.of(CatalogSchemas.PRODUCT, "id", "name", "description", "price")
        .withFilter(QueryFilters.eq("id", id))
        .withInclude("reviews", "rating", "body")
        .withInclude("supplier", "name", "country");
    EntityGraph g = facade.fetch(q, REQUEST);
    return g.isEmpty() ? null : g.nodes().get(0);
  }

  /** Listing rows carry only what the list view shows. */
  public ProjectedRows list(int offset, int limit) {
    EntityQuery q = EntityQuery.of(CatalogSchemas.PRODUCT, "id", "name", "price")
        .withSort(List.of(SortField.asc("id")))
        .withPage(new OffsetPage(offset, limit));
    return facade.project(q, REQUEST);
  }

  public EntityGraph search(EntityQuery query) {
    if (query == null) throw new IllegalArgumentException("A query with explicit fields is required");
    return facade.fetch(query, REQUEST);
  }
}
