package com.openforge.taskcore.template;

import com.openforge.taskcore.domain.TaskTemplate;

public record ResolvedTemplate(TaskTemplate template, SimilarityResult similarity) {}
