package com.codeheadsystems.tollgate.server.directory;

import com.codeheadsystems.tollgate.server.exceptions.ConflictException;
import java.util.Optional;

/**
 * Persistence contract for account records.
 * <p>
 * Implementations must keep usernames and emails unique (emails case-insensitively) and must
 * make every write durable before returning.
 */
public interface UserDirectory {

  Optional<Account> findById(String id);

  Optional<Account> findByUsername(String username);

  Optional<Account> findByEmail(String email);

  /**
   * Stores a new account.
   *
   * @param account the account
   * @return the stored account
   * @throws ConflictException if the email or username is already taken
   */
  Account create(Account account);

  /**
   * Replaces an existing account.
   *
   * @param account the account, matched by id
   * @return the stored account
   * @throws IllegalArgumentException if no account has that id
   * @throws ConflictException        if the new email or username belongs to another account
   */
  Account update(Account account);
}
