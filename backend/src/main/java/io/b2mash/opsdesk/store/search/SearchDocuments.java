package io.b2mash.opsdesk.store.search;

import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.EntityType;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Converts records to and from the flat document stored in the search index. */
final class SearchDocuments {

  static final String ENTITY_TYPE = "entityType";
  static final String ID = "id";
  static final String VERSION = "version";
  static final String DELETED = "deleted";
  static final String STATUS = "status";
  static final String TITLE = "title";
  static final String BODY = "body";
  /** Title and body together, the field keyword queries match against. */
  static final String TEXT = "text";
  static final String OWNER_ID = "ownerId";
  static final String COMPANY_ID = "companyId";
  static final String TECHNICIAN_ID = "technicianId";
  static final String PARENT_ID = "parentId";
  static final String CREATED_AT = "createdAt";
  static final String UPDATED_AT = "updatedAt";

  private SearchDocuments() {}

  /** The JSON document as stored in the index. */
  static final class Source extends LinkedHashMap<String, Object> {

    private static final long serialVersionUID = 1L;
  }

  static Source toSource(EntityRecord record) {
    var source = new Source();
    source.put(ENTITY_TYPE, record.type().name());
    source.put(ID, record.id().toString());
    source.put(VERSION, record.version());
    source.put(DELETED, record.deleted());
    source.put(STATUS, record.status());
    source.put(TITLE, record.title());
    source.put(BODY, record.body());
    source.put(TEXT, record.searchableText());
    source.put(OWNER_ID, asString(record.ownerId()));
    source.put(COMPANY_ID, asString(record.companyId()));
    source.put(TECHNICIAN_ID, asString(record.technicianId()));
    source.put(PARENT_ID, asString(record.parentId()));
    source.put(CREATED_AT, asString(record.createdAt()));
    source.put(UPDATED_AT, asString(record.updatedAt()));
    return source;
  }

  static EntityRecord fromSource(Map<String, Object> source) {
    return new EntityRecord(
        EntityType.valueOf((String) source.get(ENTITY_TYPE)),
        UUID.fromString((String) source.get(ID)),
        ((Number) source.get(VERSION)).longValue(),
        Boolean.TRUE.equals(source.get(DELETED)),
        (String) source.get(STATUS),
        (String) source.get(TITLE),
        (String) source.get(BODY),
        uuid(source.get(OWNER_ID)),
        uuid(source.get(COMPANY_ID)),
        uuid(source.get(TECHNICIAN_ID)),
        uuid(source.get(PARENT_ID)),
        instant(source.get(CREATED_AT)),
        instant(source.get(UPDATED_AT)));
  }

  private static String asString(Object value) {
    return value != null ? value.toString() : null;
  }

  private static UUID uuid(Object value) {
    return value != null ? UUID.fromString(value.toString()) : null;
  }

  private static Instant instant(Object value) {
    return value != null ? Instant.parse(value.toString()) : null;
  }
}
