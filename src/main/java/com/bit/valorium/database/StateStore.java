package com.bit.valorium.database;

import com.bit.valorium.result.Result;
import com.bit.valorium.structure.state.ChainState;

/**
 * 状态持久化边界
 */
public interface StateStore {

    /**
     * 保存链、余额、待处理交易和节点质押信誉
     */
    Result<Void> saveState(ChainState state);

    /**
     * 文件不存在或损坏时返回失败结果，由调用方决定回退到创世状态
     */
    Result<ChainState> loadState();
}
