package org.waabox.fanout;

import java.util.List;

/**
 * The known set of change channels raised by the source store.
 *
 * <p>Each name matches a PostgreSQL {@code NOTIFY} channel fired by the
 * triggers of the corresponding table.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangeChannels {

  /** Match data (score, quarter, possession) changes. */
  public static final String MATCHDATA = "matchdata_change";

  /** Match row changes. */
  public static final String MATCH = "match_change";

  /** Scoreboard settings changes. */
  public static final String SCOREBOARD = "scoreboard_change";

  /** Play clock changes. */
  public static final String PLAYCLOCK = "playclock_change";

  /** Game clock changes. */
  public static final String GAMECLOCK = "gameclock_change";

  /** Football event (play by play) changes. */
  public static final String FOOTBALL_EVENT = "football_event_change";

  /** Roster (player in match) changes. */
  public static final String PLAYER_MATCH = "player_match_change";

  /** All the channels above, in registration order. */
  public static final List<String> DEFAULT = List.of(
      MATCHDATA,
      MATCH,
      SCOREBOARD,
      PLAYCLOCK,
      GAMECLOCK,
      FOOTBALL_EVENT,
      PLAYER_MATCH);

  /** Private constructor to prevent instantiation. */
  private ChangeChannels() {
    throw new UnsupportedOperationException("Utility class");
  }
}
