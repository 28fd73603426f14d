package com.weiwo.bridge.dto;

/**
 * 合同正文中的一个附件链接
 *
 * @param databaseName  来源 ERP 数据库（导出目录名）
 * @param contractOrd   合同序号
 * @param contractTitle 合同标题
 * @param href          链接地址，如 /SYSA/edit/upimages/202033194410445.pdf
 * @param displayName   链接文字，即附件的显示名称
 */
public record ContractLink(String databaseName, int contractOrd, String contractTitle,
                           String href, String displayName) {
}
