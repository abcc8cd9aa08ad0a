package com.transmissionweb.feeder.service;

import com.transmissionweb.feeder.exception.InvalidPatternException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 피드 제목 필터.
 * 대소문자를 구분하며, 제목 어디에든 패턴이 나타나면 매칭으로 봅니다.
 */
@Component
public class FeedPatternMatcher {

    public Pattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw InvalidPatternException.blank();
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw InvalidPatternException.of(pattern, e);
        }
    }

    public void validate(String pattern) {
        compile(pattern);
    }

    public boolean matches(Pattern pattern, String title) {
        if (title == null) {
            return false;
        }
        return pattern.matcher(title).find();
    }
}
