package io.b2mash.opsdesk.sales;

import static io.b2mash.opsdesk.sales.LeadStatus.CONTACTED;
import static io.b2mash.opsdesk.sales.LeadStatus.CONVERTED;
import static io.b2mash.opsdesk.sales.LeadStatus.LOST;
import static io.b2mash.opsdesk.sales.LeadStatus.NEW;
import static io.b2mash.opsdesk.sales.LeadStatus.QUALIFIED;

import io.b2mash.opsdesk.lifecycle.Audience;
import io.b2mash.opsdesk.lifecycle.LifecycleEvent;
import java.util.EnumSet;
import java.util.Set;

public enum LeadEvent implements LifecycleEvent<LeadStatus> {
  CONTACT("contact", EnumSet.of(NEW), CONTACTED, Audience.OWNER),
  QUALIFY("qualify", EnumSet.of(CONTACTED), QUALIFIED, Audience.NONE),
  MARK_LOST("mark lost", EnumSet.of(NEW, CONTACTED, QUALIFIED), LOST, Audience.OWNER),
  CONVERT("convert", EnumSet.of(QUALIFIED), CONVERTED, Audience.NONE);

  private final String action;
  private final Set<LeadStatus> sources;
  private final LeadStatus target;
  private final Audience audience;

  LeadEvent(String action, Set<LeadStatus> sources, LeadStatus target, Audience audience) {
    this.action = action;
    this.sources = sources;
    this.target = target;
    this.audience = audience;
  }

  @Override
  public String action() {
    return action;
  }

  @Override
  public Set<LeadStatus> sources() {
    return sources;
  }

  @Override
  public LeadStatus target() {
    return target;
  }

  @Override
  public Audience audience() {
    return audience;
  }
}
