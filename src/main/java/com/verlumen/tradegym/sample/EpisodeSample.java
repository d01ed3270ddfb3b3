package com.verlumen.tradegym.sample;

/** The data of exactly one episode, always derived fresh from a {@link TrialSample}. */
public interface EpisodeSample extends DataSample {}
