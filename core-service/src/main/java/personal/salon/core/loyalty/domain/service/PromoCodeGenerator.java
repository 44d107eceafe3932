package personal.salon.core.loyalty.domain.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 사람이 읽기 쉬운 XXX-XXX 형식의 프로모션 코드 생성
 * 혼동되는 문자(0, O, 1, I)는 쓰지 않는다.
 */
@Component
public class PromoCodeGenerator {

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int GROUP_LENGTH = 3;

    private final SecureRandom random = new SecureRandom();

    public String next() {
        StringBuilder code = new StringBuilder(GROUP_LENGTH * 2 + 1);
        appendGroup(code);
        code.append('-');
        appendGroup(code);
        return code.toString();
    }

    private void appendGroup(StringBuilder code) {
        for (int i = 0; i < GROUP_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
    }
}
