package io.intellixity.polystage.mongo;

import org.bson.Document;

import java.util.List;

/** Backend-native read statement for MongoDB. */
public record MongoStatement(
    Kind kind,
    String collection,
    Document filter,
    Document projection,
    Document sort,
    Integer skip,
    Integer limit,
    List<Document> pipeline
) {
  public enum Kind {
    FIND,
    AGGREGATE
  }

  public static MongoStatement find(String collection, Document filter, Document projection, Document sort,
                                    Integer skip, Integer limit) {
    return new MongoStatement(Kind.FIND, collection, filter == null ? new Document() : filter, projection, sort,
        skip, limit, List.of());
  }

  public static MongoStatement aggregate(String collection, List<Document> pipeline) {
    return new MongoStatement(Kind.AGGREGATE, collection, null, null, null, null, null, List.copyOf(pipeline));
  }
}
