package io.b2mash.opsdesk.sales;

import static io.b2mash.opsdesk.sales.OfferStatus.ACCEPTED;
import static io.b2mash.opsdesk.sales.OfferStatus.DRAFT;
import static io.b2mash.opsdesk.sales.OfferStatus.EXPIRED;
import static io.b2mash.opsdesk.sales.OfferStatus.REJECTED;
import static io.b2mash.opsdesk.sales.OfferStatus.SENT;

import io.b2mash.opsdesk.lifecycle.Audience;
import io.b2mash.opsdesk.lifecycle.LifecycleEvent;
import java.util.EnumSet;
import java.util.Set;

/** Offer transitions. Sending is irreversible: no event leads back to DRAFT. */
public enum OfferEvent implements LifecycleEvent<OfferStatus> {
  SEND("send", EnumSet.of(DRAFT), SENT, Audience.COMPANY, true),
  ACCEPT("accept", EnumSet.of(SENT), ACCEPTED, Audience.NONE, true),
  REJECT("reject", EnumSet.of(SENT), REJECTED, Audience.OWNER, true),
  EXPIRE("expire", EnumSet.of(SENT), EXPIRED, Audience.OWNER, false);

  private final String action;
  private final Set<OfferStatus> sources;
  private final OfferStatus target;
  private final Audience audience;
  private final boolean clientInvocable;

  OfferEvent(
      String action,
      Set<OfferStatus> sources,
      OfferStatus target,
      Audience audience,
      boolean clientInvocable) {
    this.action = action;
    this.sources = sources;
    this.target = target;
    this.audience = audience;
    this.clientInvocable = clientInvocable;
  }

  @Override
  public String action() {
    return action;
  }

  @Override
  public Set<OfferStatus> sources() {
    return sources;
  }

  @Override
  public OfferStatus target() {
    return target;
  }

  @Override
  public Audience audience() {
    return audience;
  }

  @Override
  public boolean clientInvocable() {
    return clientInvocable;
  }
}
