package me.golemcore.promptforge.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.promptforge.domain.model.ComplexityTier;
import me.golemcore.promptforge.domain.model.ProjectComplexity;

import java.util.List;
import java.util.Map;

/**
 * Lookup tables that turn raw wizard answers into requirement lists. Keys are
 * lower-case; unknown keys contribute nothing.
 */
final class NormalizationTables {

    static final String PLATFORM_WEB = "web";
    static final String PLATFORM_MOBILE = "mobile";
    static final String DEFAULT_TARGET_AUDIENCE = "General users";

    static final Map<String, List<String>> TECHNICAL_BY_PLATFORM = Map.of(
            PLATFORM_WEB, List.of(
                    "Responsive web design for all screen sizes",
                    "Progressive Web App (PWA) capabilities",
                    "Cross-browser compatibility"),
            PLATFORM_MOBILE, List.of(
                    "Mobile-first responsive design",
                    "Touch-optimized interactions",
                    "Fast loading on mobile networks"));

    static final Map<ProjectComplexity, List<String>> TECHNICAL_BY_COMPLEXITY = Map.of(
            ProjectComplexity.SIMPLE, List.of(
                    "Simple, clean architecture",
                    "Minimal external dependencies"),
            ProjectComplexity.MEDIUM, List.of(
                    "Modular component architecture",
                    "State management for user data",
                    "API integration capabilities"),
            ProjectComplexity.COMPLEX, List.of(
                    "Scalable architecture with separation of concerns",
                    "Advanced state management",
                    "Database integration with relationships",
                    "Authentication and authorization"));

    static final Map<ComplexityTier, List<String>> TECHNICAL_BY_EXPERIENCE = Map.of(
            ComplexityTier.BEGINNER, List.of(
                    "Well-commented, readable code",
                    "Simple deployment process",
                    "Clear documentation for setup"),
            ComplexityTier.INTERMEDIATE, List.of(
                    "Consistent project structure with clear module boundaries",
                    "Conventional tooling for linting and formatting",
                    "Basic automated tests for core flows"),
            ComplexityTier.ADVANCED, List.of(
                    "Performance optimization",
                    "Advanced TypeScript patterns",
                    "Comprehensive testing setup"));

    static final Map<String, List<String>> UI_BY_STYLE = Map.of(
            "minimal", List.of(
                    "Clean, uncluttered interface",
                    "Generous white space",
                    "Simple typography hierarchy",
                    "Subtle color palette"),
            "playful", List.of(
                    "Vibrant color scheme",
                    "Engaging animations and transitions",
                    "Fun, approachable typography",
                    "Interactive elements with personality"),
            "business", List.of(
                    "Professional color scheme",
                    "Clear information hierarchy",
                    "Trust-building design elements",
                    "Consistent corporate styling"));

    static final List<String> UI_MOBILE = List.of(
            "Touch-friendly button sizes (minimum 44px)",
            "Swipe gestures where appropriate",
            "Bottom navigation for mobile");

    static final List<String> UI_BASELINE = List.of(
            "Accessibility compliance (WCAG 2.1)",
            "Cross-browser compatibility",
            "Loading states and error handling",
            "Consistent design system");

    static final List<String> CONSTRAINTS_WEB_ONLY = List.of(
            "Web-only implementation",
            "No native mobile app features");

    static final Map<ComplexityTier, List<String>> CONSTRAINTS_BY_EXPERIENCE = Map.of(
            ComplexityTier.BEGINNER, List.of(
                    "Use well-documented, popular libraries",
                    "Avoid complex build processes",
                    "Prioritize simplicity over advanced features"));

    static final Map<ProjectComplexity, List<String>> CONSTRAINTS_BY_COMPLEXITY = Map.of(
            ProjectComplexity.SIMPLE, List.of(
                    "Keep feature scope minimal",
                    "Focus on core functionality",
                    "Avoid over-engineering"));

    static final List<String> CONSTRAINTS_BASELINE = List.of(
            "Follow modern web standards",
            "Ensure security best practices",
            "Optimize for performance");

    static final Map<String, List<String>> TECH_STACK_BY_TOOL = Map.of(
            "lovable", List.of("React", "TypeScript", "Tailwind CSS", "Supabase", "shadcn/ui"),
            "v0", List.of("React", "TypeScript", "Tailwind CSS", "Next.js"),
            "bolt", List.of("React", "TypeScript", "Vite", "CSS Modules"),
            "cursor", List.of("TypeScript", "Node.js", "Modern JavaScript"));

    static final List<String> DEFAULT_TECH_STACK = List.of("React", "TypeScript", "Modern CSS");

    static final List<String> WEB_STACK_ADDITIONS = List.of("HTML5", "CSS3");

    private NormalizationTables() {
    }
}
