package io.github.samzhu.invoicing.dto;

import java.util.List;

/**
 * 一次載入的結果：有效紀錄與剔除紀錄，各自維持輸入順序。
 *
 * @param valid 轉換成功的用量紀錄
 * @param rejected 被剔除的元素
 */
public record LoadResult(
    List<UsageRecord> valid,
    List<RecordRejection> rejected
) {
    public LoadResult {
        valid = List.copyOf(valid);
        rejected = List.copyOf(rejected);
    }

    /**
     * @return 輸入元素總數
     */
    public int totalEntries() {
        return valid.size() + rejected.size();
    }
}
