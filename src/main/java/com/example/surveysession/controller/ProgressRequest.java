package com.example.surveysession.controller;

import com.example.surveysession.model.SurveyAnswers;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProgressRequest {
    private Integer page;
    private SurveyAnswers data;
}
