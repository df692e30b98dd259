package com.github.fsmdsl.model;

import java.util.Objects;

/**
 * A logical timer. It is armed by {@code start_timer(id)}, disarmed by {@code stop_timer(id)} or
 * by leaving the state that armed it, and raises its event after {@link #getDuration()} time
 * units.
 */
public final class Timer {
  private final String id;
  private final long duration;
  private final String event;
  private final boolean periodic;
  private final SourcePosition position;

  public Timer(final String id, final long duration, final String event, final boolean periodic,
      final SourcePosition position) {
    this.id = id;
    this.duration = duration;
    this.event = event;
    this.periodic = periodic;
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public Timer(final String id, final long duration, final String event, final boolean periodic) {
    this(id, duration, event, periodic, SourcePosition.UNKNOWN);
  }

  public String getId() {
    return id;
  }

  public long getDuration() {
    return duration;
  }

  public String getEvent() {
    return event;
  }

  public boolean isPeriodic() {
    return periodic;
  }

  public SourcePosition getPosition() {
    return position;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, duration, event, periodic);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Timer other = (Timer) obj;
    return Objects.equals(id, other.id) && duration == other.duration
        && Objects.equals(event, other.event) && periodic == other.periodic;
  }

  @Override
  public String toString() {
    return "Timer [id=" + id + ", duration=" + duration + ", event=" + event + ", periodic="
        + periodic + "]";
  }
}
