package org.dooq.ddbjson;

import org.dooq.ddbjson.model.Document;
import org.dooq.ddbjson.model.NormalValue;
import org.dooq.ddbjson.model.TaggedValue;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public interface ItemConverter {

    /**
     * DynamoDB item to plain mapping, the envelope flag of the document is irrelevant here.
     */
    @NotNull NormalValue.Mapping unmarshallItem(@NotNull Document document);

    @NotNull NormalValue unmarshallValue(@NotNull TaggedValue value);

    @NotNull Document marshallItem(@NotNull NormalValue.Mapping item, boolean wrapItem);

    @NotNull TaggedValue marshallValue(@NotNull NormalValue value);

    default List<NormalValue.Mapping> readAll(@NotNull List<Document> documents) {
        return documents.stream()
                .map(this::unmarshallItem)
                .toList();
    }

    default List<Document> writeAll(@NotNull List<NormalValue.Mapping> items, boolean wrapItem) {
        return items.stream()
                .map(item -> marshallItem(item, wrapItem))
                .toList();
    }
}
