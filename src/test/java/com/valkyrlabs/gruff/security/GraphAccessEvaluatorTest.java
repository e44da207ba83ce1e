package com.valkyrlabs.gruff.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.valkyrlabs.api.AclEntryRepository;
import com.valkyrlabs.gruff.cache.EffectiveGroupsCache;
import com.valkyrlabs.gruff.group.GroupHierarchyResolver;
import com.valkyrlabs.model.AclPermission;
import com.valkyrlabs.model.AclScoped;
import com.valkyrlabs.model.PrincipalType;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GraphAccessEvaluatorTest {

  private static final Set<AclPermission> READ_OR_WRITE = EnumSet.of(AclPermission.READ, AclPermission.WRITE);
  private static final Set<AclPermission> WRITE_ONLY = EnumSet.of(AclPermission.WRITE);

  @Mock
  private AclEntryRepository aclEntryRepository;

  @Mock
  private GroupHierarchyResolver groupResolver;

  @Mock
  private EffectiveGroupsCache effectiveGroupsCache;

  private final UUID user = UUID.randomUUID();
  private final UUID group = UUID.randomUUID();

  private GraphAccessEvaluator sut;

  @BeforeEach
  void setUp() {
    sut = new GraphAccessEvaluator(aclEntryRepository, groupResolver, effectiveGroupsCache, 3);
  }

  private void userInGroups(Set<UUID> groups) {
    when(effectiveGroupsCache.get(eq(user), any())).thenReturn(groups);
  }

  static final class Row implements AclScoped {
    private final Long aclId;

    Row(Long aclId) {
      this.aclId = aclId;
    }

    @Override
    public Long getAclId() {
      return aclId;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Row other && Objects.equals(aclId, other.aclId);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(aclId);
    }
  }

  @Nested
  class HasPermission {

    @Test
    void publicAcl_grantsEveryone() {
      assertTrue(sut.hasPermission(null, user, AclPermission.WRITE));
      assertTrue(sut.hasPermission(null, null, AclPermission.READ));
      verifyNoInteractions(aclEntryRepository, effectiveGroupsCache);
    }

    @Test
    void anonymousCaller_isDeniedOnProtectedAcl() {
      assertFalse(sut.hasPermission(7L, null, AclPermission.READ));
      verifyNoInteractions(aclEntryRepository);
    }

    @Test
    void writeGrant_satisfiesReadCheck() {
      userInGroups(Set.of());
      when(aclEntryRepository.findAclIdsGranting(PrincipalType.USER, List.of(user), READ_OR_WRITE))
          .thenReturn(List.of(7L));

      assertTrue(sut.hasPermission(7L, user, AclPermission.READ));
    }

    @Test
    void readGrant_doesNotSatisfyWriteCheck() {
      userInGroups(Set.of());
      when(aclEntryRepository.findAclIdsGranting(PrincipalType.USER, List.of(user), WRITE_ONLY))
          .thenReturn(List.of());

      assertFalse(sut.hasPermission(7L, user, AclPermission.WRITE));
    }

    @Test
    void grantToEffectiveGroup_applies() {
      userInGroups(Set.of(group));
      when(aclEntryRepository.findAclIdsGranting(PrincipalType.USER, List.of(user), READ_OR_WRITE))
          .thenReturn(List.of());
      when(aclEntryRepository.findAclIdsGranting(PrincipalType.GROUP, Set.of(group), READ_OR_WRITE))
          .thenReturn(List.of(9L));

      assertTrue(sut.hasPermission(9L, user, AclPermission.READ));
      assertFalse(sut.hasPermission(10L, user, AclPermission.READ));
    }
  }

  @Nested
  class ListFilter {

    @Test
    void noAccessibleAcls_restrictsToPublicRows() {
      AclListFilter filter = sut.buildListFilter(null, AclPermission.READ, "acl_id");

      assertTrue(filter.isUseFilter());
      assertEquals("acl_id IS NULL", filter.getClause());
      assertTrue(filter.getBindings().isEmpty());
    }

    @Test
    void fewAccessibleAcls_inlineInClause() {
      userInGroups(Set.of());
      when(aclEntryRepository.findAclIdsGranting(PrincipalType.USER, List.of(user), READ_OR_WRITE))
          .thenReturn(List.of(1L, 2L));

      AclListFilter filter = sut.buildListFilter(user, AclPermission.READ, "e.acl_id");

      assertTrue(filter.isUseFilter());
      assertEquals("(e.acl_id IS NULL OR e.acl_id IN (?, ?))", filter.getClause());
      assertEquals(List.of(1L, 2L), filter.getBindings());
    }

    @Test
    void tooManyAccessibleAcls_disablesClause() {
      userInGroups(Set.of());
      when(aclEntryRepository.findAclIdsGranting(PrincipalType.USER, List.of(user), READ_OR_WRITE))
          .thenReturn(List.of(1L, 2L, 3L, 4L));

      AclListFilter filter = sut.buildListFilter(user, AclPermission.READ, "acl_id");

      assertFalse(filter.isUseFilter());
      assertNull(filter.getClause());
      assertEquals(Set.of(1L, 2L, 3L, 4L), filter.getAccessibleAclIds());
    }

    @Test
    void columnNameMustBeIdentifier() {
      assertThrows(IllegalArgumentException.class,
          () -> sut.buildListFilter(user, AclPermission.READ, "acl_id; drop table acls"));
    }
  }

  @Nested
  class FilterByPermission {

    @Test
    void admitsPublicAndAccessibleRowsInOrder() {
      List<Row> rows = List.of(new Row(null), new Row(1L), new Row(2L), new Row(3L));

      List<Row> admitted = GraphAccessEvaluator.filterByPermission(rows, Set.of(3L, 1L));

      assertEquals(List.of(new Row(null), new Row(1L), new Row(3L)), admitted);
    }

    @Test
    void matchesWhatAnInClauseWouldSelect() {
      Set<Long> accessible = LongStream.rangeClosed(1, 1500).filter(i -> i % 2 == 0).boxed()
          .collect(Collectors.toSet());
      List<Row> rows = new ArrayList<>();
      for (long i = 0; i < 3000; i++) {
        rows.add(new Row(i % 7 == 0 ? null : i));
      }

      List<Row> expected = rows.stream()
          .filter(r -> r.getAclId() == null || accessible.contains(r.getAclId()))
          .collect(Collectors.toList());

      assertEquals(expected, GraphAccessEvaluator.filterByPermission(rows, accessible));
    }
  }
}
