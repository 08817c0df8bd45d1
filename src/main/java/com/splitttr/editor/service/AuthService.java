package com.splitttr.editor.service;

import com.splitttr.editor.model.AppUser;
import com.splitttr.editor.repo.AppUserRepository;
import com.splitttr.editor.service.EditorException.ConflictException;
import com.splitttr.editor.service.EditorException.UnauthorizedException;
import com.splitttr.editor.service.EditorException.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonString;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@ApplicationScoped
public class AuthService {

  private static final Logger log = Logger.getLogger(AuthService.class);

  @Inject JsonWebToken jwt;
  @Inject AppUserRepository users;

  // The identity provider puts its user id into "sub".
  @Transactional
  public AppUser upsertCurrentUser() {
    String subject = jwt.getSubject();
    if (subject == null || subject.isBlank()) {
      throw new UnauthorizedException("User not authenticated");
    }

    AppUser existing = users.findBySubject(subject);
    if (existing != null) {
      String name = displayName();
      if (name != null && !name.equals(existing.displayName)) existing.displayName = name;
      return existing;
    }

    AppUser u = new AppUser();
    u.id = UUID.randomUUID();
    u.subject = subject;
    u.displayName = displayName();
    u.createdAt = Instant.now();
    users.persist(u);
    log.debugf("Registered user %s for subject %s", u.id, subject);
    return u;
  }

  public UUID currentUserId() {
    return upsertCurrentUser().id;
  }

  @Transactional
  public AppUser me() {
    return upsertCurrentUser();
  }

  @Transactional
  public AppUser setUsername(String username) {
    AppUser u = upsertCurrentUser();

    if (username == null || username.isBlank()) {
      throw new ValidationException("username required");
    }
    username = username.trim().toLowerCase(Locale.ROOT);

    if (username.length() < 4 || username.length() > 64) {
      throw new ValidationException("username must be 4-64 characters");
    }
    if (!username.matches("[a-z0-9_]+")) {
      throw new ValidationException("username may contain only a-z, 0-9 and underscore");
    }

    AppUser other = users.findByUsername(username);
    if (other != null && !other.id.equals(u.id)) {
      throw new ConflictException("username already taken");
    }

    u.username = username;
    return u;
  }

  private String displayName() {
    String name = claimText("name");
    return name != null ? name : claimText("preferred_username");
  }

  // Custom claims may surface as JSON values rather than plain strings.
  private String claimText(String claim) {
    Object value = jwt.getClaim(claim);
    String text = value instanceof JsonString js ? js.getString() : value == null ? null : value.toString();
    return (text == null || text.isBlank()) ? null : text;
  }
}
