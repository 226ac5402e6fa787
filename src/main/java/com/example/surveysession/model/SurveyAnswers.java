package com.example.surveysession.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers collected across the survey pages. Every field is optional; a
 * progress save carries only the fields of the page being saved.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SurveyAnswers {

    // basic information
    private String gender;
    private String yearOfStudy;
    private String fieldOfStudy;
    private String university;

    // social media habits
    private List<String> socialMediaPlatforms;
    private String timeSpentOnSocialMedia;
    private String followsTechContent;
    private List<String> techUpdateSources;

    // phone usage
    private String currentPhoneBrand;
    private List<String> topPhoneFunctions;
    private String phoneChangeFrequency;
    private String tecnoExperience;
    private String tecnoExperienceRating;

    // skills and work
    private List<String> learningSkills;
    private List<String> partTimeWork;

    // new phone preferences
    private List<String> phoneFeaturesRanking;
    private String phoneBudget;
    private List<String> preferredPhoneColors;

    // campus ambassador program
    private Boolean interestedInAmbassador;
    private List<String> ambassadorStrengths;
    private List<String> ambassadorBenefits;
    private String name;
    private String contactNumber;
    private String socialMediaLink;
    private String followerCount;

    private String suggestions;

    public static SurveyAnswers empty() {
        return new SurveyAnswers();
    }

    /**
     * Field-wise merge: every field set in {@code patch} replaces the one here.
     * Lists are replaced whole. Neither operand is modified.
     */
    public SurveyAnswers mergedWith(SurveyAnswers patch) {
        if (patch == null) {
            return toBuilder().build();
        }
        return SurveyAnswers.builder()
                .gender(pick(patch.gender, gender))
                .yearOfStudy(pick(patch.yearOfStudy, yearOfStudy))
                .fieldOfStudy(pick(patch.fieldOfStudy, fieldOfStudy))
                .university(pick(patch.university, university))
                .socialMediaPlatforms(pickList(patch.socialMediaPlatforms, socialMediaPlatforms))
                .timeSpentOnSocialMedia(pick(patch.timeSpentOnSocialMedia, timeSpentOnSocialMedia))
                .followsTechContent(pick(patch.followsTechContent, followsTechContent))
                .techUpdateSources(pickList(patch.techUpdateSources, techUpdateSources))
                .currentPhoneBrand(pick(patch.currentPhoneBrand, currentPhoneBrand))
                .topPhoneFunctions(pickList(patch.topPhoneFunctions, topPhoneFunctions))
                .phoneChangeFrequency(pick(patch.phoneChangeFrequency, phoneChangeFrequency))
                .tecnoExperience(pick(patch.tecnoExperience, tecnoExperience))
                .tecnoExperienceRating(pick(patch.tecnoExperienceRating, tecnoExperienceRating))
                .learningSkills(pickList(patch.learningSkills, learningSkills))
                .partTimeWork(pickList(patch.partTimeWork, partTimeWork))
                .phoneFeaturesRanking(pickList(patch.phoneFeaturesRanking, phoneFeaturesRanking))
                .phoneBudget(pick(patch.phoneBudget, phoneBudget))
                .preferredPhoneColors(pickList(patch.preferredPhoneColors, preferredPhoneColors))
                .interestedInAmbassador(pick(patch.interestedInAmbassador, interestedInAmbassador))
                .ambassadorStrengths(pickList(patch.ambassadorStrengths, ambassadorStrengths))
                .ambassadorBenefits(pickList(patch.ambassadorBenefits, ambassadorBenefits))
                .name(pick(patch.name, name))
                .contactNumber(pick(patch.contactNumber, contactNumber))
                .socialMediaLink(pick(patch.socialMediaLink, socialMediaLink))
                .followerCount(pick(patch.followerCount, followerCount))
                .suggestions(pick(patch.suggestions, suggestions))
                .build();
    }

    private static <T> T pick(T incoming, T current) {
        return incoming != null ? incoming : current;
    }

    private static List<String> pickList(List<String> incoming, List<String> current) {
        return incoming != null ? new ArrayList<>(incoming) : current;
    }
}
