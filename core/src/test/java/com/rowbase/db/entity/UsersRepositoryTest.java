package com.rowbase.db.entity;

import static org.junit.jupiter.api.Assertions.*;

import com.rowbase.common.status.Status;
import com.rowbase.common.status.StatusCode;
import com.rowbase.common.status.StatusOr;
import com.rowbase.db.util.PostgresTestHelper;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Tests for the users repository against a real PostgreSQL.
 *
 * <p>Every test runs inside a transaction that is rolled back afterwards, so each test creates
 * the table itself and identifiers start at 1.
 */
@Testcontainers(disabledWithoutDocker = true)
public class UsersRepositoryTest {

  @Container
  private static final PostgreSQLContainer<?> postgres =
      PostgresTestHelper.createPostgresContainer("rowbase_users_test");

  private static HikariDataSource dataSource;

  private final UsersRepository users = new UsersRepository();
  private Connection connection;

  @BeforeAll
  static void setUp() {
    dataSource = PostgresTestHelper.createDataSource(postgres);
  }

  @AfterAll
  static void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  @BeforeEach
  void beginTransaction() throws SQLException {
    connection = PostgresTestHelper.beginTransaction(dataSource);
    assertTrue(users.create(connection).isOk());
  }

  @AfterEach
  void rollback() throws SQLException {
    PostgresTestHelper.rollback(connection);
  }

  @Test
  void testSave_AssignsId_AndRowCanBeFound() {
    // Given: A user that was never saved
    User user = new User("test@email.com", "Krzysztof", "Nowak");

    // When: We save it
    StatusOr<Long> idOr = users.save(connection, user);

    // Then: It gets an identifier and reads back equal apart from the identifier
    assertTrue(idOr.isOk(), () -> idOr.getStatus().toString());
    StatusOr<Optional<User>> found = users.findById(connection, idOr.getValue());
    assertTrue(found.isOk());
    assertTrue(found.getValue().isPresent());
    assertEquals(user.withId(Optional.of(idOr.getValue())), found.getValue().get());
  }

  @Test
  void testSaveAll_ReturnsIdsInInputOrder_AndFindAllReturnsEveryRow() {
    // Given: Ten users
    List<User> input = IntStream.rangeClosed(1, 10)
        .mapToObj(n -> new User("test@email.com", "Krzysztof" + n, "Nowak"))
        .toList();

    // When: We save them all
    StatusOr<List<Long>> idsOr = users.saveAll(connection, input);
    StatusOr<List<User>> all = users.findAll(connection);

    // Then: One identifier per row, and all rows come back in insertion order
    assertTrue(idsOr.isOk());
    assertEquals(10, idsOr.getValue().size());
    assertTrue(all.isOk());
    assertEquals(10, all.getValue().size());
    assertEquals("Krzysztof1", all.getValue().get(0).firstName());
    assertEquals("Krzysztof10", all.getValue().get(9).firstName());
    assertEquals(idsOr.getValue(), all.getValue().stream().map(u -> u.id().orElseThrow()).toList());
  }

  @Test
  void testSaveAll_OnEmptyList_ReturnsNoIds() {
    StatusOr<List<Long>> idsOr = users.saveAll(connection, List.of());

    assertTrue(idsOr.isOk());
    assertTrue(idsOr.getValue().isEmpty());
  }

  @Test
  void testFindById_ReturnsEmpty_WhenIdDoesNotExist() {
    StatusOr<Optional<User>> result = users.findById(connection, 42L);

    // Absence is not an error
    assertTrue(result.isOk());
    assertFalse(result.getValue().isPresent());
  }

  @Test
  void testFindExistingById_ReturnsRow_WhenExists() {
    // Given: A saved user
    User user = new User("test@email.com", "Krzysztof", "Nowak");
    Long id = users.save(connection, user).getValue();

    // When: We look it up as an existing row
    StatusOr<User> result = users.findExistingById(connection, id);

    // Then: The stored fields are returned along with the identifier
    assertTrue(result.isOk());
    assertEquals("test@email.com", result.getValue().email());
    assertEquals("Krzysztof", result.getValue().firstName());
    assertEquals("Nowak", result.getValue().lastName());
    assertEquals(Optional.of(id), result.getValue().id());
  }

  @Test
  void testFindExistingById_ReturnsNotFound_WhenIdDoesNotExist() {
    StatusOr<User> result = users.findExistingById(connection, 42L);

    assertTrue(result.isNotOk());
    assertEquals(StatusCode.NOT_FOUND, result.getStatus().getCode());
  }

  @Test
  void testSave_UpdatesExistingRow_WhenIdPresent() {
    // Given: A saved user
    Long id = users.save(connection, new User("test@email.com", "Krzysztof", "Nowak")).getValue();
    User stored = users.findExistingById(connection, id).getValue();

    // When: We save it again with other names
    StatusOr<Long> updateOr = users.save(connection, stored.withNames("Jerzy", "Muller"));

    // Then: The identifier is unchanged, the row is updated, and no row was added
    assertTrue(updateOr.isOk());
    assertEquals(id, updateOr.getValue());
    User updated = users.findExistingById(connection, id).getValue();
    assertEquals(new User(Optional.of(id), "test@email.com", "Jerzy", "Muller"), updated);
    assertEquals(1L, users.count(connection).getValue());
  }

  @Test
  void testSave_ReturnsNotFound_WhenUpdatingMissingRow() {
    User ghost = new User(Optional.of(99L), "ghost@email.com", "Nobody", "Here");

    StatusOr<Long> result = users.save(connection, ghost);

    assertTrue(result.isNotOk());
    assertEquals(StatusCode.NOT_FOUND, result.getStatus().getCode());
    assertEquals(0L, users.count(connection).getValue());
  }

  @Test
  void testFindAll_ReturnsSavedIds() {
    List<User> input = threeUsers();

    List<Long> ids = users.saveAll(connection, input).getValue();
    List<User> all = users.findAll(connection).getValue();

    assertEquals(ids, all.stream().map(u -> u.id().orElseThrow()).toList());
  }

  @Test
  void testFindAll_SortedById_EqualsInputWithIds() {
    List<User> input = threeUsers();

    List<Long> ids = users.saveAll(connection, input).getValue();
    List<User> fromDb = new ArrayList<>(users.findAll(connection).getValue());
    fromDb.sort(Comparator.comparing(u -> u.id().orElseThrow()));

    assertEquals(withIds(input, ids), fromDb);
  }

  @Test
  void testFindByIds_ReturnsRequestedRowsInRequestedOrder() {
    // Given: Three saved users
    List<User> saved = withIds(threeUsers(), users.saveAll(connection, threeUsers()).getValue());

    // When: We ask for the last and the first, in that order, plus an unknown id
    List<Long> requested = List.of(
        saved.get(2).id().orElseThrow(), 1000L, saved.get(0).id().orElseThrow());
    StatusOr<List<User>> result = users.findByIds(connection, requested);

    // Then: Exactly those two rows come back in the requested order
    assertTrue(result.isOk());
    assertEquals(List.of(saved.get(2), saved.get(0)), result.getValue());
    assertEquals(3, users.findAll(connection).getValue().size());
  }

  @Test
  void testFindByIds_OnEmptyList_ReturnsNothing() {
    users.saveAll(connection, threeUsers());

    StatusOr<List<User>> result = users.findByIds(connection, List.of());

    assertTrue(result.isOk());
    assertTrue(result.getValue().isEmpty());
  }

  @Test
  void testCopyAndSave_InsertsCopyUnderNewId() {
    // Given: A saved user
    User user = new User("test1@email.com", "Krzysztof", "Nowak");
    Long id = users.save(connection, user).getValue();

    // When: We copy it
    StatusOr<Long> copyIdOr = users.copyAndSave(connection, id);

    // Then: The copy has its own identifier and the same fields
    assertTrue(copyIdOr.isOk());
    assertNotEquals(id, copyIdOr.getValue());
    User copy = users.findExistingById(connection, copyIdOr.getValue()).getValue();
    assertEquals(user.withId(Optional.of(copyIdOr.getValue())), copy);
    assertEquals(2L, users.count(connection).getValue());
  }

  @Test
  void testCopyAndSave_ReturnsNotFound_WhenSourceDoesNotExist() {
    StatusOr<Long> result = users.copyAndSave(connection, 7L);

    assertTrue(result.isNotOk());
    assertEquals(StatusCode.NOT_FOUND, result.getStatus().getCode());
  }

  @Test
  void testDeleteById_RemovesOnlyThatRow() {
    // Given: Three saved users
    List<User> input = threeUsers();
    List<Long> ids = users.saveAll(connection, input).getValue();
    List<User> saved = withIds(input, ids);

    // When: We delete the middle one
    StatusOr<Integer> deleted = users.deleteById(connection, ids.get(1));

    // Then: The other two remain
    assertTrue(deleted.isOk());
    assertEquals(1, deleted.getValue());
    assertEquals(List.of(saved.get(0), saved.get(2)), users.findAll(connection).getValue());
    assertFalse(users.findById(connection, ids.get(1)).getValue().isPresent());
  }

  @Test
  void testDeleteById_ReturnsZero_WhenIdDoesNotExist() {
    StatusOr<Integer> deleted = users.deleteById(connection, 5L);

    assertTrue(deleted.isOk());
    assertEquals(0, deleted.getValue());
  }

  @Test
  void testDeleteAll_LeavesTableEmpty() {
    users.saveAll(connection, threeUsers());
    assertEquals(3, users.findAll(connection).getValue().size());

    StatusOr<Integer> deleted = users.deleteAll(connection);

    assertTrue(deleted.isOk());
    assertEquals(3, deleted.getValue());
    assertTrue(users.findAll(connection).getValue().isEmpty());
  }

  @Test
  void testExampleScenario_IdsAreSequential_AndDeletedIdIsGone() {
    List<User> input = List.of(
        new User("a@x", "K", "N"),
        new User("b@x", "J", "N"),
        new User("c@x", "M", "N"));

    List<Long> ids = users.saveAll(connection, input).getValue();
    assertEquals(List.of(1L, 2L, 3L), ids);

    users.deleteById(connection, 2L);

    List<User> all = users.findAll(connection).getValue();
    assertEquals(List.of(1L, 3L), all.stream().map(u -> u.id().orElseThrow()).toList());
    assertEquals(input.get(0).withId(Optional.of(1L)), all.get(0));
    assertEquals(input.get(2).withId(Optional.of(3L)), all.get(1));
  }

  @Test
  void testDeletedId_IsNotReused() {
    Long first = users.save(connection, new User("a@x", "K", "N")).getValue();
    users.deleteById(connection, first);

    Long second = users.save(connection, new User("a@x", "K", "N")).getValue();

    assertNotEquals(first, second);
  }

  @Test
  void testCreate_IsIdempotent() {
    users.save(connection, new User("a@x", "K", "N"));

    Status again = users.create(connection);

    assertTrue(again.isOk());
    assertEquals(1L, users.count(connection).getValue());
  }

  @Test
  void testDrop_RemovesTable() {
    // Given: The table created in setup
    Status dropped = users.drop(connection);
    assertTrue(dropped.isOk());

    // When: We query it afterwards
    StatusOr<List<User>> result = users.findAll(connection);

    // Then: The backend error is passed through with its cause
    assertTrue(result.isNotOk());
    assertEquals(StatusCode.FAILED_PRECONDITION, result.getStatus().getCode());
    assertInstanceOf(SQLException.class, result.getStatus().getCause());
  }

  @Test
  void testSaveAll_RollsBackWholeBatch_WhenOneRowFailsInAutoCommitMode() throws SQLException {
    // Given: A committed table of its own, outside the per-test transaction
    connection.rollback();
    connection.setAutoCommit(true);
    UsersRepository batchUsers = new UsersRepository(new UserTable("users_batch"));
    assertTrue(batchUsers.create(connection).isOk());
    try {
      // When: The second row of a batch updates a row that does not exist
      List<User> batch = List.of(
          new User("a@x", "K", "N"),
          new User(Optional.of(404L), "b@x", "J", "N"),
          new User("c@x", "M", "N"));
      StatusOr<List<Long>> result = batchUsers.saveAll(connection, batch);

      // Then: The batch fails and nothing from it was kept
      assertTrue(result.isNotOk());
      assertEquals(StatusCode.NOT_FOUND, result.getStatus().getCode());
      assertEquals(0L, batchUsers.count(connection).getValue());
      assertTrue(connection.getAutoCommit());
    } finally {
      batchUsers.drop(connection);
    }
  }

  private static List<User> threeUsers() {
    return List.of(
        new User("test1@email.com", "Krzysztof", "Nowak"),
        new User("test2@email.com", "Janek", "Nowak"),
        new User("test3@email.com", "Marcin", "Nowak"));
  }

  private static List<User> withIds(List<User> input, List<Long> ids) {
    assertEquals(input.size(), ids.size());
    return IntStream.range(0, input.size())
        .mapToObj(i -> input.get(i).withId(Optional.of(ids.get(i))))
        .toList();
  }
}
