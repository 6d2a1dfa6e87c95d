package io.intellixity.frugal.examples.web;

import io.intellixity.frugal.access.exec.EntityGraph;
import io.intellixity.frugal.access.exec.EntityNode;
import io.intellixity.frugal.access.exec.ProjectedRows;
import io.intellixity.frugal.access.query.EntityQuery;
import io.intellixity.frugal.examples.service.ProductService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/products")
public final class ProductController {
  private final ProductService products;

  public ProductController(ProductService products) {
    this.products = products;
  }

  @GetMapping
  public ProjectedRows list(@RequestParam(name = "offset", defaultValue = "0") int offset,
                            @RequestParam(name = "limit", defaultValue = "50") int limit) {
    return products.list(offset, Math.min(limit, 500));
  }

  @GetMapping("/{id}")
  public ResponseEntity<EntityNode> get(@PathVariable("id") long id) {
    EntityNode p = products.get(id);
    return (p == null) ? ResponseEntity.notFound().build() : ResponseEntity.ok(p);
  }

  @PostMapping("/search")
  public EntityGraph search(@RequestBody EntityQuery query) {
    return products.search(query);
  }
}
