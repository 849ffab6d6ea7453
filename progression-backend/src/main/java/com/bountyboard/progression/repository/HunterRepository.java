package com.bountyboard.progression.repository;

import com.bountyboard.progression.entity.Hunter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface HunterRepository extends JpaRepository<Hunter, String> {
}
