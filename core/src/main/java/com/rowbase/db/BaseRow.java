package com.rowbase.db;

import java.util.Optional;

/**
 * A row of an entity table. The identifier is empty until the row has been inserted and is set by
 * the database on insert.
 *
 * <p>Rows are meant to be records:
 *
 * <pre>
 * public record User(Optional&lt;Long&gt; id, String email, String firstName, String lastName)
 *     implements BaseRow&lt;Long, User&gt; {
 *   &#64;Override
 *   public User withId(Optional&lt;Long&gt; id) {
 *     return new User(id, email, firstName, lastName);
 *   }
 * }
 * </pre>
 *
 * @param <I> the identifier type
 * @param <R> the row type itself
 */
public interface BaseRow<I, R extends BaseRow<I, R>> {

  /** The identifier, empty before the row is persisted. */
  Optional<I> id();

  /** Returns a copy of this row with the given identifier. */
  R withId(Optional<I> id);
}
