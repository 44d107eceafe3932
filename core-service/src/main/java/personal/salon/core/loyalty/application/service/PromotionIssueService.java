package personal.salon.core.loyalty.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.loyalty.application.port.in.IssuePromotionCommand;
import personal.salon.core.loyalty.application.port.in.IssuePromotionUseCase;
import personal.salon.core.loyalty.application.port.out.PromotionLedger;
import personal.salon.core.loyalty.domain.exception.InvalidDiscountPercentageException;
import personal.salon.core.loyalty.domain.exception.PromotionAlreadyIssuedException;
import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Promotion Issue Service
 * 매장/고객 단위 프로모션 코드 발급 (ISSUED 상태로 시작)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionIssueService implements IssuePromotionUseCase {

    private static final BigDecimal MAX_PERCENTAGE = BigDecimal.valueOf(100);

    private final PromotionLedger promotionLedger;
    private final Clock clock;

    @Override
    @Transactional
    public UserPromotion issuePromotion(IssuePromotionCommand command) {
        if (command.merchantId() == null || command.userId() == null
                || command.code() == null || command.code().isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Required fields: merchantId, userId, code, discountPercentage");
        }
        BigDecimal percentage = command.discountPercentage();
        if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(MAX_PERCENTAGE) > 0) {
            throw new InvalidDiscountPercentageException(percentage);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (command.expiresAt() != null && !command.expiresAt().isAfter(now)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expiry must be in the future");
        }

        String code = command.code().trim();
        if (promotionLedger.existsCode(command.userId(), command.merchantId(), code)) {
            throw new PromotionAlreadyIssuedException(code);
        }

        try {
            UserPromotion issued = promotionLedger.issue(UserPromotion.issue(
                    command.userId(), command.merchantId(), code, percentage, command.expiresAt(), now));
            log.info("Promotion issued: promotionId={}, merchantId={}, userId={}",
                    issued.id(), issued.merchantId(), issued.userId());
            return issued;
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent promotion issue detected: merchantId={}, userId={}, code={}",
                    command.merchantId(), command.userId(), code);
            throw new PromotionAlreadyIssuedException(code);
        }
    }
}
