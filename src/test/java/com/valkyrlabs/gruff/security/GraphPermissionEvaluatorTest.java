package com.valkyrlabs.gruff.security;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.valkyrlabs.gruff.version.EntityVersionService;
import com.valkyrlabs.gruff.version.LinkVersionService;
import com.valkyrlabs.model.AclPermission;
import com.valkyrlabs.model.GraphEntity;
import com.valkyrlabs.model.GraphLink;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class GraphPermissionEvaluatorTest {

  @Mock
  private GraphAccessEvaluator access;

  @Mock
  private EntityVersionService entities;

  @Mock
  private LinkVersionService links;

  private final AuthenticationFacade authenticationFacade = new AuthenticationFacade();
  private final UUID userId = UUID.randomUUID();
  private final UUID entityId = UUID.randomUUID();

  private GraphPermissionEvaluator sut;
  private Authentication auth;

  @BeforeEach
  void setUp() {
    sut = new GraphPermissionEvaluator(access, authenticationFacade, entities, links);
    auth = new UsernamePasswordAuthenticationToken(userId.toString(), "n/a",
        List.of(new SimpleGrantedAuthority("ROLE_USER")));
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
  }

  private GraphEntity latestEntity(Long aclId) {
    GraphEntity latest = new GraphEntity(UUID.randomUUID());
    latest.setId(UUID.randomUUID());
    latest.setLatest(true);
    latest.setAclId(aclId);
    return latest;
  }

  @Nested
  class ById {

    @Test
    void checksAclOfLatestVersion() {
      when(entities.findLatest(entityId)).thenReturn(latestEntity(42L));
      when(access.hasPermission(42L, userId, AclPermission.WRITE)).thenReturn(true);

      assertTrue(sut.hasPermission(auth, entityId, "entity", "write"));
    }

    @Test
    void acceptsClassNameAndStringId() {
      when(entities.findLatest(entityId)).thenReturn(latestEntity(42L));
      when(access.hasPermission(42L, userId, AclPermission.READ)).thenReturn(true);

      assertTrue(sut.hasPermission(auth, entityId.toString(), GraphEntity.class.getName(), "READ"));
    }

    @Test
    void linksResolveThroughLinkChains() {
      GraphLink link = new GraphLink(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
      link.setId(entityId);
      when(links.findLatest(entityId)).thenReturn(link);
      when(access.hasPermission(null, userId, AclPermission.READ)).thenReturn(true);

      assertTrue(sut.hasPermission(auth, entityId, "link", "read"));
      verifyNoInteractions(entities);
    }

    @Test
    void missingTarget_denies() {
      assertFalse(sut.hasPermission(auth, entityId, "entity", "read"));
      verifyNoInteractions(access);
    }

    @Test
    void unknownPermission_denies() {
      when(entities.findLatest(entityId)).thenReturn(latestEntity(42L));

      assertFalse(sut.hasPermission(auth, entityId, "entity", "administer"));
      verifyNoInteractions(access);
    }

    @Test
    void unknownType_denies() {
      assertFalse(sut.hasPermission(auth, entityId, "widget", "read"));
      verifyNoInteractions(entities, links, access);
    }

    @Test
    void malformedId_denies() {
      assertFalse(sut.hasPermission(auth, "not-a-uuid", "entity", "read"));
    }
  }

  @Test
  void domainObject_isReResolvedToLatestVersion() {
    GraphEntity stale = latestEntity(1L);
    stale.setLatest(false);
    when(entities.findLatest(stale.getId())).thenReturn(latestEntity(2L));
    when(access.hasPermission(2L, userId, AclPermission.READ)).thenReturn(false);

    assertFalse(sut.hasPermission(auth, stale, "read"));
    verify(access).hasPermission(2L, userId, AclPermission.READ);
  }

  @Test
  void anonymousCaller_isPassedAsNoUser() {
    Authentication anonymous = new AnonymousAuthenticationToken("key", "anonymousUser",
        List.of(new SimpleGrantedAuthority("ROLE_ANONYMOUS")));
    when(entities.findLatest(entityId)).thenReturn(latestEntity(null));
    when(access.hasPermission(null, null, AclPermission.READ)).thenReturn(true);

    assertTrue(sut.hasPermission(anonymous, entityId, "entity", "read"));
    assertNull(authenticationFacade.resolveUserId(anonymous));
  }
}
