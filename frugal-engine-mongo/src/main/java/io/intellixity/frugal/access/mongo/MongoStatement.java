package io.intellixity.frugal.access.mongo;

import io.intellixity.frugal.access.spi.store.NativeStatement;
import org.bson.Document;

import java.util.List;

/** Backend-native statement representation for MongoDB. */
public record MongoStatement(
    Kind kind,
    String collection,
    Document filter,
    Document projection,
    Document sort,
    Integer skip,
    Integer limit,
    List<Document> pipeline
) implements NativeStatement {
  public enum Kind {
    FIND,
    AGGREGATE
  }

  static MongoStatement find(String collection, Document filter, Document projection, Document sort, Integer skip, Integer limit) {
    return new MongoStatement(Kind.FIND, collection, filter, projection, sort, skip, limit, null);
  }

  static MongoStatement aggregate(String collection, List<Document> pipeline) {
    return new MongoStatement(Kind.AGGREGATE, collection, null, null, null, null, null, List.copyOf(pipeline));
  }
}
