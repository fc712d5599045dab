package io.chatpad.pilot.team;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamMemberRepository extends JpaRepository<TeamMember, UUID> {

  boolean existsByOwnerIdAndMemberId(UUID ownerId, UUID memberId);

  boolean existsByOwnerIdAndMemberIdAndRole(UUID ownerId, UUID memberId, String role);

  Optional<TeamMember> findByOwnerIdAndMemberId(UUID ownerId, UUID memberId);

  List<TeamMember> findByOwnerIdOrderByCreatedAtAsc(UUID ownerId);

  /**
   * Memberships of a principal, earliest first. The schema does not forbid a principal from
   * belonging to several owners, so callers that need a single owner take the first row.
   */
  @Query(
      "SELECT tm FROM TeamMember tm WHERE tm.memberId = :memberId"
          + " ORDER BY tm.createdAt ASC, tm.id ASC")
  List<TeamMember> findMembershipsOf(@Param("memberId") UUID memberId);

  @Modifying
  @Query("DELETE FROM TeamMember tm WHERE tm.ownerId = :ownerId")
  int deleteAllByOwnerId(@Param("ownerId") UUID ownerId);

  @Modifying
  @Query("DELETE FROM TeamMember tm WHERE tm.memberId = :memberId")
  int deleteAllByMemberId(@Param("memberId") UUID memberId);
}
