package personal.salon.core.loyalty.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.common.dto.ApiResponse;
import personal.salon.core.loyalty.adapter.in.web.dto.IssueLoyalCustomerPromotionsRequest;
import personal.salon.core.loyalty.adapter.in.web.dto.IssuePromotionRequest;
import personal.salon.core.loyalty.adapter.in.web.dto.LoyalCustomerPromotionsResponse;
import personal.salon.core.loyalty.adapter.in.web.dto.LoyaltyStatusResponse;
import personal.salon.core.loyalty.adapter.in.web.dto.PromotionResponse;
import personal.salon.core.loyalty.adapter.in.web.dto.RewardResponse;
import personal.salon.core.loyalty.application.port.in.GetAvailableRewardsUseCase;
import personal.salon.core.loyalty.application.port.in.GetLoyaltyStatusUseCase;
import personal.salon.core.loyalty.application.port.in.GetUserPromotionsUseCase;
import personal.salon.core.loyalty.application.port.in.IssueLoyalCustomerPromotionsUseCase;
import personal.salon.core.loyalty.application.port.in.IssuePromotionUseCase;
import personal.salon.core.loyalty.domain.model.UserPromotion;

import java.util.List;

/**
 * Loyalty API Controller
 * 리워드/적립 현황/보유 프로모션 조회 및 프로모션 발급
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class LoyaltyController {

    private final GetAvailableRewardsUseCase getAvailableRewardsUseCase;
    private final GetLoyaltyStatusUseCase getLoyaltyStatusUseCase;
    private final GetUserPromotionsUseCase getUserPromotionsUseCase;
    private final IssuePromotionUseCase issuePromotionUseCase;
    private final IssueLoyalCustomerPromotionsUseCase issueLoyalCustomerPromotionsUseCase;

    /**
     * 사용 가능한 리워드 목록
     * GET /api/v1/merchants/{merchantId}/rewards
     */
    @GetMapping("/merchants/{merchantId}/rewards")
    public ResponseEntity<ApiResponse<List<RewardResponse>>> getAvailableRewards(
            @PathVariable Long merchantId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Get available rewards: merchantId={}, userId={}", merchantId, userId);

        List<RewardResponse> rewards = getAvailableRewardsUseCase.getAvailableRewards(userId, merchantId)
                .stream()
                .map(RewardResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Available rewards retrieved successfully", rewards));
    }

    /**
     * 적립 현황
     * GET /api/v1/merchants/{merchantId}/loyalty
     */
    @GetMapping("/merchants/{merchantId}/loyalty")
    public ResponseEntity<ApiResponse<LoyaltyStatusResponse>> getLoyaltyStatus(
            @PathVariable Long merchantId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Get loyalty status: merchantId={}, userId={}", merchantId, userId);

        LoyaltyStatusResponse response = LoyaltyStatusResponse.from(
                getLoyaltyStatusUseCase.getLoyaltyStatus(userId, merchantId));

        return ResponseEntity.ok(ApiResponse.success("Loyalty program retrieved successfully", response));
    }

    /**
     * 프로모션 코드 발급
     * POST /api/v1/merchants/{merchantId}/promotions
     */
    @PostMapping("/merchants/{merchantId}/promotions")
    public ResponseEntity<ApiResponse<PromotionResponse>> issuePromotion(
            @PathVariable Long merchantId,
            @RequestHeader("X-User-Id") Long operatorId,
            @Valid @RequestBody IssuePromotionRequest request
    ) {
        log.info("Issue promotion: merchantId={}, operatorId={}, targetUserId={}",
                merchantId, operatorId, request.userId());

        UserPromotion issued = issuePromotionUseCase.issuePromotion(request.toCommand(merchantId));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Promotion issued successfully", PromotionResponse.from(issued)));
    }

    /**
     * 내 프로모션 목록 (전체 매장, 최근 발급 순)
     * GET /api/v1/promotions
     */
    @GetMapping("/promotions")
    public ResponseEntity<ApiResponse<List<PromotionResponse>>> getMyPromotions(
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Get promotions: userId={}", userId);

        List<PromotionResponse> promotions = getUserPromotionsUseCase.getPromotions(userId)
                .stream()
                .map(PromotionResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Promotions retrieved successfully", promotions));
    }

    /**
     * 단골 고객 일괄 발급
     * POST /api/v1/merchants/{merchantId}/promotions/loyal-customers
     * 대상이 없으면 200과 0건, 발급되면 201
     */
    @PostMapping("/merchants/{merchantId}/promotions/loyal-customers")
    public ResponseEntity<ApiResponse<LoyalCustomerPromotionsResponse>> issueLoyalCustomerPromotions(
            @PathVariable Long merchantId,
            @RequestHeader("X-User-Id") Long operatorId,
            @Valid @RequestBody IssueLoyalCustomerPromotionsRequest request
    ) {
        log.info("Issue loyal customer promotions: merchantId={}, operatorId={}", merchantId, operatorId);

        List<UserPromotion> issued = issueLoyalCustomerPromotionsUseCase
                .issueToLoyalCustomers(request.toCommand(merchantId));
        LoyalCustomerPromotionsResponse response = LoyalCustomerPromotionsResponse.from(issued);

        if (issued.isEmpty()) {
            return ResponseEntity.ok(ApiResponse.success("No loyal customers found", response));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Promotions sent to loyal customers", response));
    }
}
