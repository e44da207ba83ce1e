package com.valkyrlabs.gruff.acl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.valkyrlabs.api.AclEntryRepository;
import com.valkyrlabs.api.AclRepository;
import com.valkyrlabs.api.GraphUserRepository;
import com.valkyrlabs.api.UserGroupRepository;
import com.valkyrlabs.model.Acl;
import com.valkyrlabs.model.AclEntry;
import com.valkyrlabs.model.AclPermission;
import com.valkyrlabs.model.GraphUser;
import com.valkyrlabs.model.PrincipalType;
import com.valkyrlabs.model.UserGroup;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class CanonicalAclStoreTest {

  @Mock
  private AclRepository aclRepository;

  @Mock
  private AclEntryRepository aclEntryRepository;

  @Mock
  private GraphUserRepository userRepository;

  @Mock
  private UserGroupRepository groupRepository;

  @Captor
  private ArgumentCaptor<Iterable<AclEntry>> entriesCaptor;

  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
  private final UUID creator = UUID.randomUUID();
  private final UUID other = UUID.randomUUID();

  private CanonicalAclStore sut;

  @BeforeEach
  void setUp() {
    sut = new CanonicalAclStore(aclRepository, aclEntryRepository, userRepository, groupRepository, clock);
  }

  private static Acl aclWithId(long id, String hash) {
    Acl acl = new Acl(hash, Instant.EPOCH);
    ReflectionTestUtils.setField(acl, "id", id);
    return acl;
  }

  private void stubInsert(long newId) {
    when(aclRepository.findByHash(anyString())).thenReturn(Optional.empty());
    when(aclRepository.save(any(Acl.class))).thenAnswer(inv -> {
      Acl acl = inv.getArgument(0);
      ReflectionTestUtils.setField(acl, "id", newId);
      return acl;
    });
  }

  private List<AclEntry> savedEntries() {
    verify(aclEntryRepository).saveAll(entriesCaptor.capture());
    List<AclEntry> rows = new ArrayList<>();
    entriesCaptor.getValue().forEach(rows::add);
    return rows;
  }

  @Nested
  class GetOrCreate {

    @Test
    void emptyEntries_isPublic() {
      assertNull(sut.getOrCreate(List.of()));
      assertNull(sut.getOrCreate(null));
      verifyNoInteractions(aclRepository, aclEntryRepository);
    }

    @Test
    void existingHash_isReused() {
      String hash = AclCanonicalizer.computeHash(List.of(AclGrant.user(creator, AclPermission.WRITE)));
      when(aclRepository.findByHash(hash)).thenReturn(Optional.of(aclWithId(5L, hash)));

      Long first = sut.getOrCreate(List.of(AclGrant.user(creator, AclPermission.WRITE)));
      Long second = sut.getOrCreate(List.of(
          AclGrant.user(creator, AclPermission.WRITE),
          AclGrant.user(creator, AclPermission.READ)));

      assertEquals(5L, first);
      assertEquals(5L, second);
      verify(aclRepository, never()).save(any());
      verifyNoInteractions(aclEntryRepository);
    }

    @Test
    void newHash_insertsAclAndDeduplicatedEntries() {
      stubInsert(11L);

      Long id = sut.getOrCreate(List.of(
          AclGrant.user(creator, AclPermission.READ),
          AclGrant.user(creator, AclPermission.WRITE),
          AclGrant.user(other, AclPermission.READ)));

      assertEquals(11L, id);
      List<AclEntry> rows = savedEntries();
      assertEquals(2, rows.size());
      for (AclEntry row : rows) {
        assertEquals(11L, row.getAclId());
        assertEquals(PrincipalType.USER, row.getPrincipalType());
      }
      assertTrue(rows.stream().anyMatch(r -> r.getPrincipalId().equals(creator)
          && r.getPermission() == AclPermission.WRITE));
      assertFalse(rows.stream().anyMatch(r -> r.getPrincipalId().equals(creator)
          && r.getPermission() == AclPermission.READ));
    }
  }

  @Nested
  class CreateForNewResource {

    @Test
    void noExplicitAcl_grantsCreatorWriteOnly() {
      stubInsert(3L);

      assertEquals(3L, sut.createForNewResource(creator, null));

      List<AclEntry> rows = savedEntries();
      assertEquals(1, rows.size());
      assertEquals(creator, rows.get(0).getPrincipalId());
      assertEquals(AclPermission.WRITE, rows.get(0).getPermission());
    }

    @Test
    void emptyExplicitAcl_isPublic() {
      assertNull(sut.createForNewResource(creator, List.of()));
      verifyNoInteractions(aclRepository, aclEntryRepository);
    }

    @Test
    void explicitAclWithoutCreator_getsCreatorWritePrepended() {
      stubInsert(4L);

      sut.createForNewResource(creator, List.of(AclGrant.user(other, AclPermission.READ)));

      List<AclEntry> rows = savedEntries();
      assertEquals(2, rows.size());
      assertEquals(creator, rows.get(0).getPrincipalId());
      assertEquals(AclPermission.WRITE, rows.get(0).getPermission());
    }

    @Test
    void creatorReadIsUpgradedToWrite() {
      stubInsert(6L);

      sut.createForNewResource(creator, List.of(AclGrant.user(creator, AclPermission.READ)));

      List<AclEntry> rows = savedEntries();
      assertEquals(1, rows.size());
      assertEquals(AclPermission.WRITE, rows.get(0).getPermission());
    }
  }

  @Nested
  class Lookups {

    @Test
    void getEntries_ofPublicAcl_isEmpty() {
      assertTrue(sut.getEntries(null).isEmpty());
      verifyNoInteractions(aclEntryRepository);
    }

    @Test
    void getEnrichedEntries_fillsNamesFromUsersAndGroups() {
      UUID groupId = UUID.randomUUID();
      UUID ghost = UUID.randomUUID();
      when(aclEntryRepository.findByAclIdOrderByPrincipalTypeAscPrincipalIdAscPermissionAsc(9L)).thenReturn(List.of(
          new AclEntry(9L, PrincipalType.GROUP, groupId, AclPermission.READ),
          new AclEntry(9L, PrincipalType.USER, creator, AclPermission.WRITE),
          new AclEntry(9L, PrincipalType.USER, other, AclPermission.READ),
          new AclEntry(9L, PrincipalType.USER, ghost, AclPermission.READ)));
      when(userRepository.findAllById(any())).thenReturn(List.of(
          new GraphUser(creator, "creator@example.com", "Creator"),
          new GraphUser(other, "other@example.com", null)));
      when(groupRepository.findAllById(any()))
          .thenReturn(List.of(new UserGroup(groupId, "editors", null, Instant.EPOCH, creator)));

      List<EnrichedAclGrant> enriched = sut.getEnrichedEntries(9L);

      assertEquals(4, enriched.size());
      assertEquals("editors", enriched.get(0).getPrincipalName());
      assertNull(enriched.get(0).getPrincipalEmail());
      assertEquals("Creator", enriched.get(1).getPrincipalName());
      assertEquals("creator@example.com", enriched.get(1).getPrincipalEmail());
      assertEquals("other@example.com", enriched.get(2).getPrincipalName());
      assertNull(enriched.get(3).getPrincipalName());
    }

    @Test
    void validatePrincipals_reportsEveryMissingPrincipal() {
      UUID missingUser = UUID.randomUUID();
      UUID missingGroup = UUID.randomUUID();
      when(userRepository.findAllById(any()))
          .thenReturn(List.of(new GraphUser(creator, "creator@example.com", "Creator")));
      when(groupRepository.findAllById(any())).thenReturn(List.of());

      PrincipalValidation result = sut.validatePrincipals(List.of(
          AclGrant.user(creator, AclPermission.WRITE),
          AclGrant.user(missingUser, AclPermission.READ),
          AclGrant.user(missingUser, AclPermission.WRITE),
          AclGrant.group(missingGroup, AclPermission.READ)));

      assertFalse(result.isValid());
      assertEquals(List.of("User not found: " + missingUser, "Group not found: " + missingGroup),
          result.getErrors());
    }

    @Test
    void validatePrincipals_ofKnownPrincipals_isValid() {
      when(userRepository.findAllById(any()))
          .thenReturn(List.of(new GraphUser(creator, "creator@example.com", "Creator")));

      assertTrue(sut.validatePrincipals(List.of(AclGrant.user(creator, AclPermission.WRITE))).isValid());
    }
  }
}
