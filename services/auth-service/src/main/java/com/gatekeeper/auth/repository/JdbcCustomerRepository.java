package com.gatekeeper.auth.repository;

import com.gatekeeper.auth.data.Condition;
import com.gatekeeper.auth.data.Payloads;
import com.gatekeeper.auth.data.QueryResult;
import com.gatekeeper.auth.data.Rows;
import com.gatekeeper.auth.data.StatementBuilder;
import com.gatekeeper.auth.data.TransactionalExecutor;
import com.gatekeeper.auth.entity.Customer;
import com.gatekeeper.auth.exception.ErrorKind;
import com.gatekeeper.auth.exception.ServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Credential records in {@code users.customer}, accessed through
 * {@link StatementBuilder} and {@link TransactionalExecutor}.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcCustomerRepository implements CustomerRepository {

    private final TransactionalExecutor executor;

    @Override
    public Optional<Customer> findByUsername(String username) {
        Rows rows = executor.fetchOne(StatementBuilder.select(Customer.DESCRIPTOR, Condition.eq("username", username)))
                .orThrow();
        return rows.first().map(row -> Payloads.toEntity(row, Customer.class));
    }

    @Override
    public boolean existsByUsername(String username) {
        Rows rows = executor.fetchOne(StatementBuilder.select(Customer.DESCRIPTOR, List.of("id"),
                        Condition.eq("username", username), "", 1, 0))
                .orThrow();
        return !rows.isEmpty();
    }

    @Override
    public Customer save(Customer customer) {
        QueryResult result = executor.execute(StatementBuilder.insert(customer, "*"), true);
        result.failure()
                .filter(failure -> failure.cause() instanceof DuplicateKeyException)
                .ifPresent(failure -> {
                    throw new ServiceException(ErrorKind.CONFLICT,
                            "Username already exists: " + customer.getUsername(), failure.cause());
                });
        Customer saved = result.orThrow().first()
                .map(row -> Payloads.toEntity(row, Customer.class))
                .orElseThrow(() -> new ServiceException(ErrorKind.STORAGE_FAILURE,
                        "Insert returned no row for " + customer.getUsername()));
        log.debug("Inserted customer id={}", saved.getId());
        return saved;
    }
}
