package io.intellixity.keyset.mongo;

import org.bson.Document;

/** One rendered {@code find}: filter, sort, limit and an optional projection (null means whole documents). */
public record MongoFindStatement(Document filter, Document sort, int limit, Document projection) {}
