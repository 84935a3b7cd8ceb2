package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.model.ResourceKind;

import java.util.List;
import java.util.function.Consumer;

/**
 * One named teardown step and the resource kinds it removes, in the order it removes them.
 */
record TeardownStep(String name, List<ResourceKind> kinds, Consumer<TeardownContext> action) {}
