package com.gatekeeper.auth.repository;

import com.gatekeeper.auth.entity.Customer;

import java.util.Optional;

/**
 * CustomerRepository - Data access for credential records.
 *
 * Methods:
 * - findByUsername: lookup used by every login flow
 * - existsByUsername: uniqueness check before registration
 * - save: insert a new record and return it as stored (with its generated id)
 *
 * Failure Behavior:
 * - A statement failure surfaces as ServiceException STORAGE_FAILURE
 * - A unique-key violation on save surfaces as ServiceException CONFLICT
 *
 * @see JdbcCustomerRepository for the SQL implementation
 */
public interface CustomerRepository {

    /**
     * @param username exact, case-sensitive username
     * @return the record, or empty when no account has this username
     */
    Optional<Customer> findByUsername(String username);

    boolean existsByUsername(String username);

    /**
     * @param customer record to insert; {@code id} is ignored when null
     * @return the inserted row
     */
    Customer save(Customer customer);
}
