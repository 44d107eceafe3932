package personal.salon.core.loyalty.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.salon.core.loyalty.application.port.out.LoyaltyProgramRepository;
import personal.salon.core.loyalty.domain.model.LoyaltyProgram;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class LoyaltyProgramPersistenceAdapter implements LoyaltyProgramRepository {

    private final JpaLoyaltyProgramRepository jpaLoyaltyProgramRepository;

    @Override
    public Optional<LoyaltyProgram> findActiveByMerchant(Long merchantId) {
        return jpaLoyaltyProgramRepository.findFirstByMerchantIdAndActiveTrueOrderByIdDesc(merchantId)
                .map(LoyaltyProgramEntity::toDomain);
    }
}
