package personal.salon.core.loyalty.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.loyalty.application.port.in.IssueLoyalCustomerPromotionsCommand;
import personal.salon.core.loyalty.application.port.in.IssueLoyalCustomerPromotionsUseCase;
import personal.salon.core.loyalty.application.port.out.LoyaltyMembershipRepository;
import personal.salon.core.loyalty.application.port.out.PromotionLedger;
import personal.salon.core.loyalty.domain.exception.InvalidDiscountPercentageException;
import personal.salon.core.loyalty.domain.model.LoyaltyMembership;
import personal.salon.core.loyalty.domain.model.UserPromotion;
import personal.salon.core.loyalty.domain.service.PromoCodeGenerator;
import personal.salon.core.notification.application.port.in.RequestNotificationUseCase;
import personal.salon.core.notification.domain.model.NotificationCategory;
import personal.salon.core.notification.domain.model.NotificationRequest;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loyal Customer Promotion Service
 * 누적 방문 수가 기준 이상인 고객 전원에게 고유 코드를 한 트랜잭션으로 발급하고,
 * 커밋 후 고객별 알림을 요청한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoyalCustomerPromotionService implements IssueLoyalCustomerPromotionsUseCase {

    static final int LOYAL_VISIT_THRESHOLD = 5;
    static final int MAX_CODE_ATTEMPTS = 5;
    private static final BigDecimal MAX_PERCENTAGE = BigDecimal.valueOf(100);

    private final LoyaltyMembershipRepository membershipRepository;
    private final PromotionLedger promotionLedger;
    private final PromoCodeGenerator promoCodeGenerator;
    private final RequestNotificationUseCase requestNotificationUseCase;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public List<UserPromotion> issueToLoyalCustomers(IssueLoyalCustomerPromotionsCommand command) {
        if (command.merchantId() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Required fields: merchantId, discountPercentage");
        }
        BigDecimal percentage = command.discountPercentage();
        if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(MAX_PERCENTAGE) > 0) {
            throw new InvalidDiscountPercentageException(percentage);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (command.expiresAt() != null && !command.expiresAt().isAfter(now)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expiry must be in the future");
        }

        List<UserPromotion> issued = transactionTemplate.execute(status -> issueAll(command, now));
        if (issued == null || issued.isEmpty()) {
            log.info("No loyal customers to reward: merchantId={}", command.merchantId());
            return List.of();
        }

        issued.forEach(this::notifyIssued);
        log.info("Loyal customer promotions issued: merchantId={}, count={}", command.merchantId(), issued.size());
        return issued;
    }

    private List<UserPromotion> issueAll(IssueLoyalCustomerPromotionsCommand command, LocalDateTime now) {
        List<LoyaltyMembership> loyal = membershipRepository
                .findWithMinimumTotalVisits(command.merchantId(), LOYAL_VISIT_THRESHOLD);

        Set<String> usedInBatch = new HashSet<>();
        List<UserPromotion> issued = new ArrayList<>(loyal.size());
        for (LoyaltyMembership membership : loyal) {
            String code = uniqueCode(command.merchantId(), usedInBatch);
            issued.add(promotionLedger.issue(UserPromotion.issue(membership.userId(), command.merchantId(),
                    code, command.discountPercentage(), command.expiresAt(), now)));
        }
        return issued;
    }

    private String uniqueCode(Long merchantId, Set<String> usedInBatch) {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String candidate = promoCodeGenerator.next();
            if (!usedInBatch.contains(candidate) && !promotionLedger.existsCodeAtMerchant(merchantId, candidate)) {
                usedInBatch.add(candidate);
                return candidate;
            }
        }
        log.error("Could not generate unique promo code: merchantId={}, attempts={}", merchantId, MAX_CODE_ATTEMPTS);
        throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to generate a unique promo code");
    }

    private void notifyIssued(UserPromotion promotion) {
        try {
            requestNotificationUseCase.request(new NotificationRequest(
                    promotion.userId(),
                    NotificationCategory.PROMOTION_ISSUED,
                    String.format("Thanks for being a loyal guest! Use code %s for %s%% off your next booking.",
                            promotion.code(),
                            promotion.discountPercentage().stripTrailingZeros().toPlainString()),
                    promotion.merchantId(),
                    null,
                    null));
        } catch (RuntimeException e) {
            log.warn("Failed to request promotion notification: promotionId={}, userId={}",
                    promotion.id(), promotion.userId(), e);
        }
    }
}
