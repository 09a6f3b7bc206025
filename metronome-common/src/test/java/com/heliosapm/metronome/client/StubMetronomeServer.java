/**
Licensed to the Apache Software Foundation (ASF) under one
or more contributor license agreements.  See the NOTICE file
distributed with this work for additional information
regarding copyright ownership.  The ASF licenses this file
to you under the Apache License, Version 2.0 (the
"License"); you may not use this file except in compliance
with the License.  You may obtain a copy of the License at

  http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing,
software distributed under the License is distributed on an
"AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
KIND, either express or implied.  See the License for the
specific language governing permissions and limitations
under the License.
 */
package com.heliosapm.metronome.client;

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;

/**
 * <p>Title: StubMetronomeServer</p>
 * <p>Description: A local http server standing in for Metronome in tests.
 * Answers every request with the configured status and body after the configured delay,
 * and records the decoded query parameters of each request.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.client.StubMetronomeServer</code></p>
 */
@Sharable
public class StubMetronomeServer extends ChannelInitializer<SocketChannel> implements Closeable {
	private static final Logger log = LogManager.getLogger(StubMetronomeServer.class);

	protected final EventLoopGroup group = new NioEventLoopGroup(1);
	protected final Channel serverChannel;
	protected final List<Map<String, List<String>>> requests = new CopyOnWriteArrayList<Map<String, List<String>>>();

	protected volatile int status = 200;
	protected volatile String body = "_({});";
	protected volatile long delayMs = 0;

	/**
	 * Creates and starts a new StubMetronomeServer on an ephemeral port
	 */
	public StubMetronomeServer() {
		final ServerBootstrap bootstrap = new ServerBootstrap();
		bootstrap.group(group)
			.channel(NioServerSocketChannel.class)
			.childHandler(this);
		serverChannel = bootstrap.bind(new InetSocketAddress("127.0.0.1", 0)).syncUninterruptibly().channel();
		log.info("Started StubMetronomeServer on [{}]", serverChannel.localAddress());
	}

	@Override
	protected void initChannel(final SocketChannel ch) throws Exception {
		final ChannelPipeline pipeline = ch.pipeline();
		pipeline.addLast(new HttpServerCodec());
		pipeline.addLast(new HttpObjectAggregator(65536));
		pipeline.addLast(new SimpleChannelInboundHandler<FullHttpRequest>() {
			@Override
			protected void channelRead0(final ChannelHandlerContext ctx, final FullHttpRequest req) throws Exception {
				requests.add(new QueryStringDecoder(req.uri()).parameters());
				final FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.valueOf(status),
						Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
				resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/javascript; charset=UTF-8");
				resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, resp.content().readableBytes());
				final Runnable send = new Runnable() {
					@Override
					public void run() {
						ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
					}
				};
				if(delayMs > 0) {
					ctx.executor().schedule(send, delayMs, TimeUnit.MILLISECONDS);
				} else {
					send.run();
				}
			}
		});
	}

	/**
	 * Sets the response returned for subsequent requests
	 * @param status The http status
	 * @param body The response body
	 * @return this server
	 */
	public StubMetronomeServer respond(final int status, final String body) {
		this.status = status;
		this.body = body;
		return this;
	}

	/**
	 * Sets the delay before each response is sent
	 * @param delayMs the delay in ms.
	 * @return this server
	 */
	public StubMetronomeServer delay(final long delayMs) {
		this.delayMs = delayMs;
		return this;
	}

	/**
	 * Returns the url of this server
	 * @return the url
	 */
	public String getUrl() {
		return "http://127.0.0.1:" + ((InetSocketAddress)serverChannel.localAddress()).getPort() + "/metronome";
	}

	/**
	 * Returns the query parameters of each request received, in arrival order
	 * @return the request parameters
	 */
	public List<Map<String, List<String>>> getRequests() {
		return requests;
	}

	/**
	 * {@inheritDoc}
	 * @see java.io.Closeable#close()
	 */
	@Override
	public void close() {
		serverChannel.close().syncUninterruptibly();
		group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
		log.info("Stopped StubMetronomeServer");
	}
}
