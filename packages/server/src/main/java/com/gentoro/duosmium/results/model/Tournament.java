package com.gentoro.duosmium.results.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Tournament header of one results record.
 *
 * <p>The level is kept verbatim; {@link #level()} only resolves the four known values. Titles are
 * derived rather than stored when the record has no explicit name.
 */
public final class Tournament {
  static final String NATIONALS_TITLE = "Science Olympiad National Tournament";

  private final String id;
  private final String name;
  private final String shortName;
  private final String levelLabel;
  private final String location;
  private final String state;
  private final String division;
  private final Integer year;
  private final String date;
  private final int droppedPlacings;
  private final Integer maximumPlace;

  private Tournament(Builder b) {
    this.id = Objects.requireNonNull(b.id, "id");
    this.name = b.name;
    this.shortName = b.shortName;
    this.levelLabel = b.levelLabel;
    this.location = b.location;
    this.state = b.state;
    this.division = b.division;
    this.year = b.year;
    this.date = b.date;
    this.droppedPlacings = b.droppedPlacings;
    this.maximumPlace = b.maximumPlace;
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public String id() {
    return id;
  }

  public Optional<String> name() {
    return Optional.ofNullable(name);
  }

  public Optional<String> shortName() {
    return Optional.ofNullable(shortName);
  }

  public String levelLabel() {
    return levelLabel;
  }

  public Optional<Level> level() {
    return Level.fromLabel(levelLabel);
  }

  public String location() {
    return location;
  }

  public String state() {
    return state;
  }

  public String division() {
    return division;
  }

  public Optional<Integer> year() {
    return Optional.ofNullable(year);
  }

  public String date() {
    return date;
  }

  /** Number of worst placings each team drops from its total. */
  public int droppedPlacings() {
    return droppedPlacings;
  }

  public Optional<Integer> maximumPlace() {
    return Optional.ofNullable(maximumPlace);
  }

  /**
   * Explicit name, or a title derived from level and location. Unknown levels without a name have
   * no title.
   */
  public Optional<String> title() {
    if (name != null && !name.isBlank()) return Optional.of(name);
    return level()
        .map(
            l ->
                switch (l) {
                  case NATIONALS -> NATIONALS_TITLE;
                  case STATES -> "%s Science Olympiad State Tournament"
                      .formatted(expandStateName(state));
                  case REGIONALS -> "%s Regional Tournament".formatted(location);
                  case INVITATIONAL -> "%s Invitational".formatted(location);
                });
  }

  /** {@link #title()} falling back to the tournament id. */
  public String displayTitle() {
    return title().orElse(id);
  }

  static String expandStateName(String state) {
    if (state == null) return null;
    return state.replace("sCA", "SoCal").replace("nCA", "NorCal");
  }

  @Override
  public String toString() {
    return "Tournament{id='" + id + "', level=" + levelLabel + ", location='" + location + "'}";
  }

  public static final class Builder {
    private final String id;
    private String name;
    private String shortName;
    private String levelLabel;
    private String location;
    private String state;
    private String division;
    private Integer year;
    private String date;
    private int droppedPlacings;
    private Integer maximumPlace;

    private Builder(String id) {
      this.id = id;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder shortName(String shortName) {
      this.shortName = shortName;
      return this;
    }

    public Builder level(String levelLabel) {
      this.levelLabel = levelLabel;
      return this;
    }

    public Builder location(String location) {
      this.location = location;
      return this;
    }

    public Builder state(String state) {
      this.state = state;
      return this;
    }

    public Builder division(String division) {
      this.division = division;
      return this;
    }

    public Builder year(Integer year) {
      this.year = year;
      return this;
    }

    public Builder date(String date) {
      this.date = date;
      return this;
    }

    public Builder droppedPlacings(int droppedPlacings) {
      this.droppedPlacings = droppedPlacings;
      return this;
    }

    public Builder maximumPlace(Integer maximumPlace) {
      this.maximumPlace = maximumPlace;
      return this;
    }

    public Tournament build() {
      return new Tournament(this);
    }
  }
}
