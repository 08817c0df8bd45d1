package com.splitttr.editor.repo;

import com.splitttr.editor.model.Folder;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.UUID;

@ApplicationScoped
public class FolderRepository implements PanacheRepositoryBase<Folder, UUID> {
}
