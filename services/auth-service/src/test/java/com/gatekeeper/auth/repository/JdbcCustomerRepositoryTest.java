package com.gatekeeper.auth.repository;

import com.gatekeeper.auth.data.QueryResult;
import com.gatekeeper.auth.data.Rows;
import com.gatekeeper.auth.data.Statement;
import com.gatekeeper.auth.data.StorageFailure;
import com.gatekeeper.auth.data.TransactionalExecutor;
import com.gatekeeper.auth.entity.Customer;
import com.gatekeeper.auth.exception.ErrorKind;
import com.gatekeeper.auth.exception.ServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcCustomerRepositoryTest {

    @Mock
    private TransactionalExecutor executor;

    private JdbcCustomerRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcCustomerRepository(executor);
    }

    private static Map<String, Object> aliceRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", 7L);
        row.put("username", "alice");
        row.put("password", "{bcrypt}hash");
        row.put("full_name", "Alice A.");
        row.put("external_identity_id", null);
        row.put("exist", true);
        return row;
    }

    private static QueryResult failure(Exception cause) {
        return QueryResult.failure(new StorageFailure("INSERT ...", cause.getMessage(), cause));
    }

    @Test
    void findByUsernameSelectsByParameterizedUsername() {
        when(executor.fetchOne(any(Statement.class))).thenReturn(QueryResult.success(Rows.of(List.of(aliceRow())), 0));

        Optional<Customer> found = repository.findByUsername("alice");

        ArgumentCaptor<Statement> captor = ArgumentCaptor.forClass(Statement.class);
        verify(executor).fetchOne(captor.capture());
        assertThat(captor.getValue().text()).isEqualTo("SELECT * FROM users.customer WHERE username = %(w0)s");
        assertThat(captor.getValue().params()).containsExactlyEntriesOf(Map.of("w0", "alice"));
        assertThat(found).hasValueSatisfying(customer -> {
            assertThat(customer.getId()).isEqualTo(7L);
            assertThat(customer.getUsername()).isEqualTo("alice");
            assertThat(customer.getFullName()).isEqualTo("Alice A.");
            assertThat(customer.getExternalIdentityId()).isNull();
        });
    }

    @Test
    void findByUsernameReturnsEmptyWhenNoRow() {
        when(executor.fetchOne(any(Statement.class))).thenReturn(QueryResult.success(Rows.none(), 0));

        assertThat(repository.findByUsername("nobody")).isEmpty();
    }

    @Test
    void findByUsernameRaisesStorageFailure() {
        when(executor.fetchOne(any(Statement.class)))
                .thenReturn(failure(new DataAccessResourceFailureException("connection refused")));

        assertThatThrownBy(() -> repository.findByUsername("alice"))
                .isInstanceOfSatisfying(ServiceException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE_FAILURE));
    }

    @Test
    void existsByUsernameSelectsOneId() {
        when(executor.fetchOne(any(Statement.class)))
                .thenReturn(QueryResult.success(Rows.of(List.of(Map.of("id", 7L))), 0));

        assertThat(repository.existsByUsername("alice")).isTrue();

        ArgumentCaptor<Statement> captor = ArgumentCaptor.forClass(Statement.class);
        verify(executor).fetchOne(captor.capture());
        assertThat(captor.getValue().text())
                .isEqualTo("SELECT id FROM users.customer WHERE username = %(w0)s LIMIT 1");
    }

    @Test
    void existsByUsernameIsFalseWithoutRows() {
        when(executor.fetchOne(any(Statement.class))).thenReturn(QueryResult.success(Rows.none(), 0));

        assertThat(repository.existsByUsername("alice")).isFalse();
    }

    @Test
    void saveInsertsPopulatedColumnsAndReturnsStoredRow() {
        when(executor.execute(any(Statement.class), eq(true)))
                .thenReturn(QueryResult.success(Rows.of(List.of(aliceRow())), 0));

        Customer saved = repository.save(Customer.builder()
                .username("alice")
                .password("{bcrypt}hash")
                .fullName("Alice A.")
                .build());

        ArgumentCaptor<Statement> captor = ArgumentCaptor.forClass(Statement.class);
        verify(executor).execute(captor.capture(), eq(true));
        assertThat(captor.getValue().text()).isEqualTo(
                "INSERT INTO users.customer (username, password, full_name)"
                        + " VALUES (%(username)s, %(password)s, %(full_name)s) RETURNING *");
        assertThat(captor.getValue().params())
                .containsEntry("username", "alice")
                .doesNotContainKeys("id", "external_identity_id");
        assertThat(saved.getId()).isEqualTo(7L);
    }

    @Test
    void saveMapsDuplicateKeyToConflict() {
        when(executor.execute(any(Statement.class), eq(true)))
                .thenReturn(failure(new DuplicateKeyException("customer_username_key")));

        assertThatThrownBy(() -> repository.save(Customer.builder().username("alice").password("h").build()))
                .isInstanceOfSatisfying(ServiceException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.CONFLICT);
                    assertThat(e.getCause()).isInstanceOf(DuplicateKeyException.class);
                });
    }

    @Test
    void saveMapsOtherFailuresToStorageFailure() {
        when(executor.execute(any(Statement.class), eq(true)))
                .thenReturn(failure(new DataAccessResourceFailureException("connection reset")));

        assertThatThrownBy(() -> repository.save(Customer.builder().username("alice").password("h").build()))
                .isInstanceOfSatisfying(ServiceException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE_FAILURE));
    }

    @Test
    void saveFailsWhenInsertReturnsNoRow() {
        when(executor.execute(any(Statement.class), eq(true))).thenReturn(QueryResult.success(Rows.none(), 1));

        assertThatThrownBy(() -> repository.save(Customer.builder().username("alice").password("h").build()))
                .isInstanceOfSatisfying(ServiceException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE_FAILURE));
    }
}
