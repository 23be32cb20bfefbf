package com.symbexlog.report.render;

import java.util.List;

/**
 * Pure transformation of finished traces into an output form.
 *
 * @param <S> what one unit is represented by
 * @param <T> output type
 */
public interface Renderer<S, T> {

    T renderMember(S member);

    T render(List<S> members);
}
