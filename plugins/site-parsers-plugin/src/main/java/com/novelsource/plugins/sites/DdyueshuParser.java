package com.novelsource.plugins.sites;

import com.novelsource.common.error.SourceException;
import com.novelsource.common.model.ChapterContent;
import com.novelsource.core.parser.BaseParser;
import com.novelsource.core.parser.ContentPage;
import com.novelsource.core.parser.ForwardingParser;

/**
 * ddyueshu splits long chapters into sections and uses the same "next" link for the
 * following section and the following chapter. Only section links are followed.
 */
public class DdyueshuParser extends ForwardingParser {

    public DdyueshuParser(BaseParser base) {
        super(base);
    }

    @Override
    public ChapterContent getChapterContent(String chapterUrl, boolean assemblePages) throws SourceException {
        ContentPage first = base.extractContentPage(chapterUrl);
        if (!assemblePages) {
            return new ChapterContent(first.rawHtml(), first.cleanedText(), first.nextUrl(), 1);
        }
        return base.assemble(first, SectionUrls::isNextSection);
    }
}
