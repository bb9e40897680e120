package yggdrasil.storage.dto;

/**
 * 全文排序结果行
 */
public interface TextRankView {

    Long getId();

    Double getRank();
}
