package com.splitttr.editor.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RoleTest {

  @Test
  void rolesAreOrderedViewerEditorOwner() {
    assertThat(Role.OWNER.atLeast(Role.EDITOR)).isTrue();
    assertThat(Role.EDITOR.atLeast(Role.VIEWER)).isTrue();
    assertThat(Role.VIEWER.atLeast(Role.EDITOR)).isFalse();
    assertThat(Role.EDITOR.atLeast(Role.OWNER)).isFalse();
  }

  @Test
  void everyRoleSatisfiesItself() {
    for (Role r : Role.values()) {
      assertThat(r.atLeast(r)).isTrue();
    }
  }

  @Test
  void onlyEditorAndOwnerCanWrite() {
    assertThat(Role.VIEWER.canWrite()).isFalse();
    assertThat(Role.EDITOR.canWrite()).isTrue();
    assertThat(Role.OWNER.canWrite()).isTrue();
  }
}
