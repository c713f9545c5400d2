/**
 * The entity and repository layer.
 *
 * <p>An entity is declared with three pieces:
 *
 * <ul>
 *   <li>a record implementing {@link com.rowbase.db.BaseRow}, whose identifier is empty until the
 *       row is inserted
 *   <li>a {@link com.rowbase.db.Table} subclass naming the table and its columns and building rows
 *       from query results
 *   <li>a {@link com.rowbase.db.BaseRepository} bound to that table, exposing the generic {@link
 *       com.rowbase.db.Repository} operations
 * </ul>
 *
 * <p>Link tables between two entities are handled by {@link com.rowbase.db.JunctionTable} and
 * {@link com.rowbase.db.JunctionRepository}.
 *
 * <p>Every operation takes the JDBC connection to run on and returns {@code Status} or {@code
 * StatusOr<T>}; the caller owns the connection and its transaction.
 */
package com.rowbase.db;
