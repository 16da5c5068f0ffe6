package com.watchpost.pipeline.inference;

import com.watchpost.pipeline.acquisition.Frame;
import com.watchpost.pipeline.core.Collaborator;
import com.watchpost.pipeline.core.InferenceException;

/** Object classification engine. Called only for sampled motion frames. */
public interface ClassificationService extends Collaborator {
    DetectionSet classify(Frame frame) throws InferenceException;
}
