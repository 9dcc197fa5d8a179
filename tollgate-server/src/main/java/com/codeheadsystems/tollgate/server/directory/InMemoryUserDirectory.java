package com.codeheadsystems.tollgate.server.directory;

import com.codeheadsystems.tollgate.server.exceptions.ConflictException;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserDirectory}.
 * <p>
 * Reads are lock-free; writes are serialized so the uniqueness checks and the index updates
 * happen atomically. All accounts are lost on restart. Suitable for development and
 * integration testing only.
 */
public class InMemoryUserDirectory implements UserDirectory {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserDirectory.class);

  private final ConcurrentHashMap<String, Account> accounts = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, String> usernameIndex = new ConcurrentHashMap<>();
  // Keyed by lower-cased email.
  private final ConcurrentHashMap<String, String> emailIndex = new ConcurrentHashMap<>();

  @Override
  public Optional<Account> findById(final String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(accounts.get(id));
  }

  @Override
  public Optional<Account> findByUsername(final String username) {
    if (username == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(usernameIndex.get(username)).map(accounts::get);
  }

  @Override
  public Optional<Account> findByEmail(final String email) {
    if (email == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(emailIndex.get(emailKey(email))).map(accounts::get);
  }

  @Override
  public synchronized Account create(final Account account) {
    log.debug("create(id={})", account.id());
    if (accounts.containsKey(account.id())) {
      throw new IllegalArgumentException("Account id already exists: " + account.id());
    }
    if (emailIndex.containsKey(emailKey(account.email()))) {
      throw new ConflictException("Email already exists");
    }
    if (usernameIndex.containsKey(account.username())) {
      throw new ConflictException("Username already exists");
    }
    accounts.put(account.id(), account);
    usernameIndex.put(account.username(), account.id());
    emailIndex.put(emailKey(account.email()), account.id());
    return account;
  }

  @Override
  public synchronized Account update(final Account account) {
    log.debug("update(id={})", account.id());
    Account existing = accounts.get(account.id());
    if (existing == null) {
      throw new IllegalArgumentException("No account with id: " + account.id());
    }
    String newEmailKey = emailKey(account.email());
    String emailOwner = emailIndex.get(newEmailKey);
    if (emailOwner != null && !emailOwner.equals(account.id())) {
      throw new ConflictException("Email already exists");
    }
    String usernameOwner = usernameIndex.get(account.username());
    if (usernameOwner != null && !usernameOwner.equals(account.id())) {
      throw new ConflictException("Username already exists");
    }
    accounts.put(account.id(), account);
    usernameIndex.put(account.username(), account.id());
    emailIndex.put(newEmailKey, account.id());
    if (!existing.username().equals(account.username())) {
      usernameIndex.remove(existing.username(), account.id());
    }
    String oldEmailKey = emailKey(existing.email());
    if (!oldEmailKey.equals(newEmailKey)) {
      emailIndex.remove(oldEmailKey, account.id());
    }
    return account;
  }

  private static String emailKey(String email) {
    return email.toLowerCase(Locale.ROOT);
  }
}
