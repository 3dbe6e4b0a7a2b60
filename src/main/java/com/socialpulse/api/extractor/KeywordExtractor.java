package com.socialpulse.api.extractor;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 제목에서 트렌드 후보 키워드를 뽑는다. 단순 빈도 기반이라 같은 단어가 두 번 나오면 두 번 반환한다.
 */
@Component
public class KeywordExtractor {

    private static final Pattern WORD = Pattern.compile("[a-z]{3,}");
    private static final int MIN_KEYWORD_LENGTH = 4;

    private static final Set<String> STOP_WORDS = Set.of((
            "the a an and or but in on at to for of is it this that with from by as "
            + "are was were be been has have had do does did will would can could may "
            + "might shall should not no so if then than too also just about up its my "
            + "your his her our their what which who whom how when where why all each "
            + "every both few more most other some such only own same into over after "
            + "before between through during above below out off again further once "
            + "here there these those am i me we they them he she you").split(" "));

    public List<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String word = m.group();
            if (word.length() >= MIN_KEYWORD_LENGTH && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }
}
