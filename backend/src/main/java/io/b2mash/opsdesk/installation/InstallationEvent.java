package io.b2mash.opsdesk.installation;

import static io.b2mash.opsdesk.installation.InstallationStatus.DONE;
import static io.b2mash.opsdesk.installation.InstallationStatus.IN_PROGRESS;
import static io.b2mash.opsdesk.installation.InstallationStatus.PENDING;
import static io.b2mash.opsdesk.installation.InstallationStatus.SCHEDULED;
import static io.b2mash.opsdesk.installation.InstallationStatus.UNDONE;

import io.b2mash.opsdesk.lifecycle.Audience;
import io.b2mash.opsdesk.lifecycle.LifecycleEvent;
import java.util.EnumSet;
import java.util.Set;

public enum InstallationEvent implements LifecycleEvent<InstallationStatus> {
  SCHEDULE("schedule", EnumSet.of(PENDING), SCHEDULED, Audience.TECHNICIAN, true),
  START("start", EnumSet.of(SCHEDULED), IN_PROGRESS, Audience.NONE, true),
  FINISH("finish", EnumSet.of(IN_PROGRESS), DONE, Audience.STAKEHOLDERS, true),
  MARK_UNDONE(
      "mark undone", EnumSet.of(SCHEDULED, IN_PROGRESS), UNDONE, Audience.STAKEHOLDERS, false);

  private final String action;
  private final Set<InstallationStatus> sources;
  private final InstallationStatus target;
  private final Audience audience;
  private final boolean clientInvocable;

  InstallationEvent(
      String action,
      Set<InstallationStatus> sources,
      InstallationStatus target,
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
  public Set<InstallationStatus> sources() {
    return sources;
  }

  @Override
  public InstallationStatus target() {
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
