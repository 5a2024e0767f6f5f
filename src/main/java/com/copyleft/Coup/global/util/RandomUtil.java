package com.copyleft.Coup.global.util;

import java.security.SecureRandom;
import java.util.Random;

public class RandomUtil {

    private static final SecureRandom random = new SecureRandom();

    /**
     * 덱 셔플 등에 쓰는 공용 난수원
     */
    public static Random random() {
        return random;
    }
}
