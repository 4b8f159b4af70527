package com.advertis.types.common;

import java.util.List;
import java.util.Set;

/**
 * 全局常量定义类。
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 调用方身份请求头 */
    public final static String USER_ID_HEADER = "X-User-Id";

    /**
     * 问卷答案键（A0-A6, D1-D7, V1-V6, E1-E6），按问卷顺序排列。
     */
    public final static List<String> ANSWER_KEYS = List.of(
            "A0", "A1", "A2", "A3", "A4", "A5", "A6",
            "D1", "D2", "D3", "D4", "D5", "D6", "D7",
            "V1", "V2", "V3", "V4", "V5", "V6",
            "E1", "E2", "E3", "E4", "E5", "E6"
    );

    private final static Set<String> ANSWER_KEY_SET = Set.copyOf(ANSWER_KEYS);

    public static boolean isKnownAnswerKey(String key) {
        return key != null && ANSWER_KEY_SET.contains(key);
    }

}
