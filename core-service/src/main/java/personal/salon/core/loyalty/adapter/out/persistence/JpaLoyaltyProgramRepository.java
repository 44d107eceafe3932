package personal.salon.core.loyalty.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for LoyaltyProgram
 */
public interface JpaLoyaltyProgramRepository extends JpaRepository<LoyaltyProgramEntity, Long> {

    Optional<LoyaltyProgramEntity> findFirstByMerchantIdAndActiveTrueOrderByIdDesc(Long merchantId);
}
