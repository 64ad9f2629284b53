package io.b2mash.opsdesk.sales;

import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.RecordQuery;
import io.b2mash.opsdesk.store.relational.RecordSource;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.domain.SliceImpl;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Offers are searched under their lead's owner and company. */
@Component
public class OfferRecordSource implements RecordSource {

  private final OfferRepository offerRepository;
  private final LeadRepository leadRepository;

  public OfferRecordSource(OfferRepository offerRepository, LeadRepository leadRepository) {
    this.offerRepository = offerRepository;
    this.leadRepository = leadRepository;
  }

  @Override
  public EntityType type() {
    return EntityType.OFFER;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<EntityRecord> load(UUID id) {
    return offerRepository
        .findById(id)
        .flatMap(offer -> leadRepository.findById(offer.getLeadId()).map(l -> toRecord(offer, l)));
  }

  @Override
  @Transactional(readOnly = true)
  public Slice<EntityRecord> page(RecordQuery query, Pageable pageable) {
    var offers = offerRepository.findRecordPage(query.ownerId(), query.companyId(), pageable);
    var leadIds = offers.getContent().stream().map(Offer::getLeadId).distinct().toList();
    Map<UUID, Lead> leads =
        leadRepository.findAllById(leadIds).stream()
            .collect(Collectors.toMap(Lead::getId, Function.identity()));
    var records =
        offers.getContent().stream()
            .filter(offer -> leads.containsKey(offer.getLeadId()))
            .map(offer -> toRecord(offer, leads.get(offer.getLeadId())))
            .toList();
    return new SliceImpl<>(records, pageable, offers.hasNext());
  }

  static String title(Offer offer, Lead lead) {
    return "Offer #" + offer.getRevision() + " for " + lead.getCompanyName();
  }

  static EntityRecord toRecord(Offer offer, Lead lead) {
    var body = new StringBuilder();
    for (var item : offer.getLineItems()) {
      body.append(item.getProductName()).append(' ');
    }
    if (offer.getNotes() != null) {
      body.append(offer.getNotes());
    }
    return new EntityRecord(
        EntityType.OFFER,
        offer.getId(),
        offer.getVersion(),
        false,
        offer.getStatus().toString(),
        title(offer, lead),
        body.toString().trim(),
        lead.getOwnerId(),
        lead.getCompanyId(),
        null,
        offer.getLeadId(),
        offer.getCreatedAt(),
        offer.getUpdatedAt());
  }
}
