package com.splitttr.editor.repo;

import com.splitttr.editor.model.AppUser;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.UUID;

@ApplicationScoped
public class AppUserRepository implements PanacheRepositoryBase<AppUser, UUID> {

  public AppUser findBySubject(String subject) {
    return find("subject", subject).firstResult();
  }

  public AppUser findByUsername(String username) {
    return find("username", username).firstResult();
  }
}
