package fanout.spi;

import java.time.Instant;

/**
 * Deletes old records from the append log.
 *
 * @see fanout.trim.LogTrimScheduler
 */
public interface LogTrimmer {

  /**
   * Deletes records appended before {@code cutoff}, at most {@code limit} rows.
   *
   * @param cutoff records with a timestamp strictly before this instant are eligible
   * @param limit  maximum number of records to delete in this call
   * @return the number of records deleted
   */
  int trimBefore(Instant cutoff, int limit);
}
