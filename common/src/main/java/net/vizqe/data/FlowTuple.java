// This file is part of VizQE.
// Copyright (C) 2026  The VizQE Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.vizqe.data;

/**
 * The identifying fields of a flow: the vrouter that saw it and its
 * seven tuple plus direction.
 */
public final class FlowTuple {

  private final String vrouter;
  private final String source_vn;
  private final String dest_vn;
  private final String source_ip;
  private final String dest_ip;
  private final long protocol;
  private final long source_port;
  private final long dest_port;
  private final long direction;

  public FlowTuple(final String vrouter,
                   final String source_vn,
                   final String dest_vn,
                   final String source_ip,
                   final String dest_ip,
                   final long protocol,
                   final long source_port,
                   final long dest_port,
                   final long direction) {
    this.vrouter = vrouter;
    this.source_vn = source_vn;
    this.dest_vn = dest_vn;
    this.source_ip = source_ip;
    this.dest_ip = dest_ip;
    this.protocol = protocol;
    this.source_port = source_port;
    this.dest_port = dest_port;
    this.direction = direction;
  }

  public String vrouter() {
    return vrouter;
  }

  public String sourceVn() {
    return source_vn;
  }

  public String destVn() {
    return dest_vn;
  }

  public String sourceIp() {
    return source_ip;
  }

  public String destIp() {
    return dest_ip;
  }

  public long protocol() {
    return protocol;
  }

  public long sourcePort() {
    return source_port;
  }

  public long destPort() {
    return dest_port;
  }

  public long direction() {
    return direction;
  }

  @Override
  public String toString() {
    return vrouter + ":" + source_vn + ":" + dest_vn + ":" + source_ip + ":" 
        + dest_ip + ":" + protocol + ":" + source_port + ":" + dest_port 
        + ":" + direction;
  }
}
