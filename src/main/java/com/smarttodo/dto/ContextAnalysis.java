package com.smarttodo.dto;

import com.smarttodo.enums.Sentiment;

import java.util.List;

public record ContextAnalysis(
        String summary,
        double importanceScore,
        Sentiment sentiment,
        List<String> keywords,
        List<String> potentialTasks,
        List<String> mentionedDeadlines,
        List<String> mentionedPeople) {

    public ContextAnalysis {
        keywords = List.copyOf(keywords);
        potentialTasks = List.copyOf(potentialTasks);
        mentionedDeadlines = List.copyOf(mentionedDeadlines);
        mentionedPeople = List.copyOf(mentionedPeople);
    }
}
