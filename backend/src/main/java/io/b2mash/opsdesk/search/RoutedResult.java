package io.b2mash.opsdesk.search;

import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.StoreKind;
import java.util.List;

/** Records answering a query and the store that served them. Never exposed to clients. */
public record RoutedResult(List<EntityRecord> records, StoreKind servedBy) {}
