package personal.salon.core.loyalty.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.core.loyalty.application.port.out.LoyaltyMembershipRepository;
import personal.salon.core.loyalty.application.port.out.LoyaltyProgramRepository;
import personal.salon.core.loyalty.application.port.out.PromotionLedger;
import personal.salon.core.loyalty.application.port.out.RewardLedger;
import personal.salon.core.loyalty.domain.exception.LoyaltyProgramNotFoundException;
import personal.salon.core.loyalty.domain.model.LoyaltyMembership;
import personal.salon.core.loyalty.domain.model.LoyaltyProgram;
import personal.salon.core.loyalty.domain.model.LoyaltyStatus;
import personal.salon.core.loyalty.domain.model.PromotionStatus;
import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoyaltyQueryService 단위 테스트")
class LoyaltyQueryServiceTest {

    private static final Long USER_ID = 10L;
    private static final Long MERCHANT_ID = 100L;

    @Mock
    private RewardLedger rewardLedger;
    @Mock
    private LoyaltyMembershipRepository membershipRepository;
    @Mock
    private LoyaltyProgramRepository programRepository;
    @Mock
    private PromotionLedger promotionLedger;

    @InjectMocks
    private LoyaltyQueryService loyaltyQueryService;

    @Test
    @DisplayName("멤버십이 없으면 방문 수 0으로 현황을 반환한다")
    void getLoyaltyStatus_NoMembershipYet() {
        LoyaltyProgram program = new LoyaltyProgram(1L, MERCHANT_ID, 5, new BigDecimal("20"), true, null);
        given(programRepository.findActiveByMerchant(MERCHANT_ID)).willReturn(Optional.of(program));
        given(membershipRepository.find(USER_ID, MERCHANT_ID)).willReturn(Optional.empty());
        given(rewardLedger.findAllByOwner(USER_ID, MERCHANT_ID)).willReturn(List.of());

        LoyaltyStatus status = loyaltyQueryService.getLoyaltyStatus(USER_ID, MERCHANT_ID);

        assertThat(status.visitsCount()).isZero();
        assertThat(status.totalVisitsCount()).isZero();
        assertThat(status.program()).isEqualTo(program);
    }

    @Test
    @DisplayName("기존 멤버십의 방문 수를 반환한다")
    void getLoyaltyStatus_ExistingMembership() {
        LoyaltyProgram program = new LoyaltyProgram(1L, MERCHANT_ID, 5, new BigDecimal("20"), true, null);
        given(programRepository.findActiveByMerchant(MERCHANT_ID)).willReturn(Optional.of(program));
        given(membershipRepository.find(USER_ID, MERCHANT_ID))
                .willReturn(Optional.of(new LoyaltyMembership(3L, USER_ID, MERCHANT_ID, 2, 7)));
        given(rewardLedger.findAllByOwner(USER_ID, MERCHANT_ID)).willReturn(List.of());

        LoyaltyStatus status = loyaltyQueryService.getLoyaltyStatus(USER_ID, MERCHANT_ID);

        assertThat(status.visitsCount()).isEqualTo(2);
        assertThat(status.totalVisitsCount()).isEqualTo(7);
    }

    @Test
    @DisplayName("활성 프로그램이 없으면 LOYALTY_PROGRAM_NOT_FOUND 예외가 발생한다")
    void getLoyaltyStatus_NoProgram() {
        given(programRepository.findActiveByMerchant(MERCHANT_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> loyaltyQueryService.getLoyaltyStatus(USER_ID, MERCHANT_ID))
                .isInstanceOf(LoyaltyProgramNotFoundException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.LOYALTY_PROGRAM_NOT_FOUND);
    }

    @Test
    @DisplayName("보유 프로모션은 매장 구분 없이 원장 순서(최근 발급 순) 그대로 반환한다")
    void getPromotions_AcrossMerchants() {
        LocalDateTime issuedAt = LocalDateTime.of(2026, 5, 1, 12, 0);
        UserPromotion recent = new UserPromotion(8L, USER_ID, 200L, "ABC-DEF", new BigDecimal("10"),
                PromotionStatus.ISSUED, null, null, null, null, issuedAt);
        UserPromotion older = new UserPromotion(7L, USER_ID, MERCHANT_ID, "WELCOME", new BigDecimal("15"),
                PromotionStatus.REDEEMED, null, issuedAt.minusDays(1), 1L, 900L, issuedAt.minusDays(3));
        given(promotionLedger.findAllByOwner(USER_ID)).willReturn(List.of(recent, older));

        List<UserPromotion> promotions = loyaltyQueryService.getPromotions(USER_ID);

        assertThat(promotions).extracting(UserPromotion::id).containsExactly(8L, 7L);
        assertThat(promotions).extracting(UserPromotion::merchantId).containsExactly(200L, MERCHANT_ID);
    }
}
