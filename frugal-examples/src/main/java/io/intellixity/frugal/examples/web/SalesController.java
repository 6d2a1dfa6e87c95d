package io.intellixity.frugal.examples.web;

import io.intellixity.frugal.access.exec.ProjectedRows;
import io.intellixity.frugal.access.query.QueryElement;
import io.intellixity.frugal.access.query.QueryFilters;
import io.intellixity.frugal.examples.service.SalesService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

@RestController
@RequestMapping("/api/sales")
public final class SalesController {
  private final SalesService sales;

  public SalesController(SalesService sales) {
    this.sales = sales;
  }

  @GetMapping("/total")
  public Map<String, Object> total(@RequestParam(name = "from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                   @RequestParam(name = "to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    BigDecimal total = sales.total(range(from, to)).asBigDecimal();
    return Map.of("from", from, "to", to, "total", total == null ? BigDecimal.ZERO : total);
  }

  @GetMapping("/by-region")
  public ProjectedRows byRegion(@RequestParam(name = "from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                @RequestParam(name = "to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    return sales.byRegion(range(from, to));
  }

  private static QueryElement range(LocalDate from, LocalDate to) {
    return QueryFilters.range("soldOn", from, to);
  }
}
