package io.b2mash.opsdesk.search;

import java.util.List;
import java.util.UUID;

/** Distinct filter values present among the records matching a filter. */
public record SearchOptions(
    List<String> entityTypes,
    List<String> statuses,
    List<UUID> ownerIds,
    List<UUID> companyIds,
    List<UUID> technicianIds) {}
