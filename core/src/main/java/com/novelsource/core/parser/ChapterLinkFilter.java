package com.novelsource.core.parser;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a catalog link is a chapter or site navigation.
 */
@FunctionalInterface
public interface ChapterLinkFilter {

    ChapterLinkFilter ACCEPT_ALL = (title, href) -> true;

    /**
     * Rejects navigation links (home, bookshelf, login, paging, ...) and titles that look
     * nothing like a chapter heading.
     */
    ChapterLinkFilter HEURISTIC = new ChapterLinkFilter() {
        private final List<String> skip = List.of(
                "首页", "书架", "排行", "分类", "搜索", "登录", "注册",
                "充值", "客服", "帮助", "关于", "联系", "广告",
                "javascript:", "mailto:", "#", "最新章节", "章节目录", "加入书签", "推荐本书",
                "上一页", "下一页", "返回");
        private final List<String> chapterWords = List.of("第", "章", "Chapter", "chapter", "卷");

        @Override
        public boolean accept(String title, String href) {
            if (title == null || href == null || title.isEmpty() || href.isEmpty()) return false;
            if (title.length() > 200 || title.length() < 2) return false;

            String t = title.toLowerCase(Locale.ROOT);
            String h = href.toLowerCase(Locale.ROOT);
            for (String word : skip) {
                if (t.contains(word) || h.contains(word)) return false;
            }
            for (String word : chapterWords) {
                if (title.contains(word)) return true;
            }
            return title.chars().anyMatch(Character::isDigit);
        }
    };

    boolean accept(String title, String href);
}
